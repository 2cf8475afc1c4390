package dev.mangaloader.batoto;

import org.jetbrains.annotations.NotNull;

/**
 * Thrown when a chapter page could not be resolved into its image URLs. Every failure is terminal for the call that
 * raised it, no partial page list is ever produced.
 */
public class PageResolutionException extends RuntimeException {
  private final FailureType failureType;

  public PageResolutionException(@NotNull String message, @NotNull FailureType failureType) {
    super(message);
    this.failureType = failureType;
  }

  public PageResolutionException(@NotNull String message, @NotNull FailureType failureType, Throwable cause) {
    super(message, cause);
    this.failureType = failureType;
  }

  @NotNull
  public FailureType getFailureType() {
    return failureType;
  }

  /**
   * The stage of the resolution pipeline that failed.
   */
  public enum FailureType {
    EXTRACTION_FAILED("page script artifacts"),
    EVALUATOR_FAILED("password expression result"),
    DECODE_FAILED("decodable payload"),
    KEY_DERIVATION_FAILED("derived key material"),
    CIPHER_FAILED("decrypted payload"),
    LENGTH_MISMATCH("matching fragment count");

    /**
     * What the pipeline could not obtain, used in log lines.
     */
    public final String friendlyName;

    FailureType(String friendlyName) {
      this.friendlyName = friendlyName;
    }
  }
}
