package dev.mangaloader.batoto.page;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mangaloader.batoto.PageResolutionException;
import dev.mangaloader.batoto.PageResolutionException.FailureType;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;

/**
 * Strict parsing of JSON arrays whose elements must all be strings. Comments, trailing tokens and non-string
 * elements are rejected.
 */
final class JsonStringArrays {
  private static final ObjectMapper MAPPER = new ObjectMapper()
      .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

  private JsonStringArrays() {
  }

  /**
   * @param json        JSON text
   * @param description What the text is, used in failure messages
   * @param failureType Failure type to report malformed input with
   * @return The array elements in order
   */
  @NotNull
  static List<String> parse(@NotNull String json, @NotNull String description, @NotNull FailureType failureType) {
    JsonNode array;

    try {
      array = MAPPER.readTree(json);
    } catch (JsonProcessingException e) {
      throw new PageResolutionException(description + " is not valid JSON", failureType, e);
    }

    if (array == null || !array.isArray()) {
      throw new PageResolutionException(description + " is not a JSON array", failureType);
    }

    List<String> values = new ArrayList<>(array.size());

    for (JsonNode element : array) {
      if (!element.isTextual()) {
        throw new PageResolutionException(description + " contains a non-string element at index " + values.size(),
            failureType);
      }

      values.add(element.textValue());
    }

    return values;
  }
}
