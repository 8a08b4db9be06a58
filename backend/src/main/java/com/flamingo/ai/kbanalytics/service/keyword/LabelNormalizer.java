package com.flamingo.ai.kbanalytics.service.keyword;

/** Turns free-form labels into stable id fragments. */
public final class LabelNormalizer {

  private LabelNormalizer() {}

  /**
   * Lowercases the label and collapses every run of non-alphanumeric characters into a single
   * hyphen, trimming hyphens at both ends. {@code "pgvector 0.4"} becomes {@code "pgvector-0-4"}.
   *
   * @return the normalized key, empty when the label has no letters or digits
   */
  public static String normalize(String label) {
    if (label == null) {
      return "";
    }
    StringBuilder key = new StringBuilder();
    boolean pendingHyphen = false;
    for (int i = 0; i < label.length(); ) {
      int codePoint = label.codePointAt(i);
      i += Character.charCount(codePoint);
      if (Character.isLetterOrDigit(codePoint)) {
        if (pendingHyphen && key.length() > 0) {
          key.append('-');
        }
        pendingHyphen = false;
        key.appendCodePoint(Character.toLowerCase(codePoint));
      } else {
        pendingHyphen = true;
      }
    }
    return key.toString();
  }
}
