package org.breadnbutter.compiler;

import com.google.gson.annotations.SerializedName;

// How a clickable region's label is compared with affordance labels
public enum RegionMatching {
  // case and whitespace must match exactly
  @SerializedName("exact") EXACT,
  // trimmed, whitespace runs collapsed, case ignored
  @SerializedName("normalized") NORMALIZED;

  public boolean matches(String affordanceLabel, String regionLabel) {
    if (affordanceLabel == null || regionLabel == null) {
      return false;
    }
    if (this == EXACT) {
      return affordanceLabel.equals(regionLabel);
    }
    return normalize(affordanceLabel).equalsIgnoreCase(normalize(regionLabel));
  }

  static String normalize(String s) {
    return s.trim().replaceAll("\\s+", " ");
  }
}
