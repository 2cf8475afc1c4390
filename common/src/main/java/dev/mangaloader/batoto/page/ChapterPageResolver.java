package dev.mangaloader.batoto.page;

import com.sedmelluq.discord.lavaplayer.tools.io.HttpClientTools;
import com.sedmelluq.discord.lavaplayer.tools.io.HttpInterface;
import dev.mangaloader.batoto.PageResolutionException;
import dev.mangaloader.batoto.cipher.PayloadDecryptor;
import dev.mangaloader.batoto.cipher.SaltedPayload;
import dev.mangaloader.batoto.evaluator.FallbackPasswordEvaluator;
import dev.mangaloader.batoto.evaluator.PasswordEvaluator;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.util.EntityUtils;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

import static dev.mangaloader.batoto.PageResolutionException.FailureType.EXTRACTION_FAILED;

/**
 * Resolves the image URLs of a chapter page: extracts the script literals, evaluates the password, decrypts the query
 * fragments and joins them with the base URLs. Nothing is cached between calls, so one resolver can serve concurrent
 * resolutions.
 */
public class ChapterPageResolver {
  private static final Logger log = LoggerFactory.getLogger(ChapterPageResolver.class);

  private final PageScriptExtractor extractor;
  private final PasswordEvaluator evaluator;
  private final Options options;
  private final Set<String> dumpedPageUrls;

  public ChapterPageResolver(@NotNull PageScriptFormat format, @NotNull PasswordEvaluator evaluator,
                             @NotNull Options options) {
    this.extractor = new PageScriptExtractor(format);
    this.evaluator = evaluator;
    this.options = options;
    this.dumpedPageUrls = ConcurrentHashMap.newKeySet();
  }

  public ChapterPageResolver(@NotNull PasswordEvaluator evaluator) {
    this(PageScriptFormat.DEFAULT, evaluator, new Options());
  }

  /**
   * Create a resolver for the default site format, evaluating passwords with the literal matcher and Rhino
   */
  public ChapterPageResolver() {
    this(FallbackPasswordEvaluator.createDefault());
  }

  /**
   * @param pageText Markup of a chapter page
   * @return Final image URLs, in the order of the page's base URL array
   */
  @NotNull
  public List<String> resolve(@NotNull String pageText) {
    PageScriptArtifacts artifacts = extractor.extract(pageText);

    String password = evaluator.evaluate(artifacts.passwordExpression);
    SaltedPayload payload = SaltedPayload.decode(artifacts.encodedWord);
    List<String> fragments = PageUrlRecombiner.parseFragments(PayloadDecryptor.decrypt(payload, password));

    log.debug("Decrypted {} query fragments for {} base URLs", fragments.size(), artifacts.baseUrls.size());
    return PageUrlRecombiner.recombine(artifacts.baseUrls, fragments);
  }

  /**
   * Same as {@link #resolve(String)}, with a stable id attached to each URL.
   */
  @NotNull
  public List<ChapterPage> resolvePages(@NotNull String pageText) {
    return resolve(pageText).stream()
        .map(ChapterPage::forUrl)
        .collect(Collectors.toList());
  }

  /**
   * Fetches a chapter page and resolves its images.
   *
   * @param httpInterface HTTP interface to use
   * @param chapterUrl    Absolute or site relative chapter URL
   * @return Resolved pages in reading order
   * @throws IOException On network IO error
   */
  @NotNull
  public List<ChapterPage> resolveChapter(@NotNull HttpInterface httpInterface,
                                          @NotNull String chapterUrl) throws IOException {
    URI uri = toAbsoluteUrl(chapterUrl, options.domain);
    log.debug("Loading chapter page {}", uri);

    String pageText;

    try (CloseableHttpResponse response = httpInterface.execute(new HttpGet(uri))) {
      HttpClientTools.assertSuccessWithContent(response, "chapter page");
      pageText = EntityUtils.toString(response.getEntity(), StandardCharsets.UTF_8);
    }

    try {
      return resolvePages(pageText);
    } catch (PageResolutionException e) {
      if (e.getFailureType() == EXTRACTION_FAILED && options.dumpProblematicPages) {
        dumpProblematicPage(pageText, uri.toString(), e.getMessage());
      }

      throw e;
    }
  }

  private void dumpProblematicPage(@NotNull String pageText, @NotNull String sourceUrl, @NotNull String issue) {
    if (!dumpedPageUrls.add(sourceUrl)) {
      return;
    }

    try {
      Path path = options.dumpDirectory == null
          ? Files.createTempFile("batoto-chapter-page", ".html")
          : Files.createTempFile(options.dumpDirectory, "batoto-chapter-page", ".html");
      Files.write(path, pageText.getBytes(StandardCharsets.UTF_8));

      log.error("Problematic chapter page {} detected (issue: {}). Dumped to {}", sourceUrl, issue,
          path.toAbsolutePath());
    } catch (IOException e) {
      log.error("Failed to dump problematic chapter page {} (issue: {})", sourceUrl, issue, e);
    }
  }

  /**
   * @param url    Chapter URL as found on the site
   * @param domain Domain relative URLs belong to
   * @return Absolute https URL
   */
  @NotNull
  static URI toAbsoluteUrl(@NotNull String url, @NotNull String domain) {
    try {
      if (url.startsWith("//")) {
        return new URI("https:" + url);
      } else if (url.startsWith("/")) {
        return new URI("https://" + domain + url);
      } else if (url.startsWith("http://") || url.startsWith("https://")) {
        return new URI(url);
      } else {
        return new URI("https://" + domain + "/" + url);
      }
    } catch (URISyntaxException e) {
      throw new IllegalArgumentException("Invalid chapter URL " + url, e);
    }
  }

  public static class Options {
    private String domain = "bato.to";
    private boolean dumpProblematicPages = false;
    private Path dumpDirectory;

    public Options withDomain(@NotNull String domain) {
      this.domain = domain;
      return this;
    }

    /**
     * @param dumpProblematicPages Whether pages whose script could not be found are written to a temp file, once per
     *                             URL, for inspection
     */
    public Options withDumpProblematicPages(boolean dumpProblematicPages) {
      this.dumpProblematicPages = dumpProblematicPages;
      return this;
    }

    /**
     * @param dumpDirectory Directory problematic pages are dumped to, the system temp directory when null
     */
    public Options withDumpDirectory(@Nullable Path dumpDirectory) {
      this.dumpDirectory = dumpDirectory;
      return this;
    }

    public String getDomain() {
      return domain;
    }

    public boolean isDumpProblematicPages() {
      return dumpProblematicPages;
    }

    @Nullable
    public Path getDumpDirectory() {
      return dumpDirectory;
    }
  }
}
