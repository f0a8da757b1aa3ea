package org.breadnbutter.resolve;

import java.util.ArrayList;
import java.util.List;

import org.breadnbutter.compiler.Diagnostic;
import org.breadnbutter.compiler.DiagnosticKind;
import org.breadnbutter.compiler.RegionMatching;
import org.breadnbutter.model.Affordance;
import org.breadnbutter.model.Breadboard;
import org.breadnbutter.model.ClickableRegion;
import org.breadnbutter.model.Place;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

// Checks that every clickable region points at exactly one affordance that navigates somewhere
public class SketchRegionValidator {
  private static final Logger log = LoggerFactory.getLogger(SketchRegionValidator.class);

  private final RegionMatching matching;
  private final List<Diagnostic> errors = new ArrayList<>();

  public SketchRegionValidator(RegionMatching matching) {
    this.matching = matching;
  }

  public List<Diagnostic> validate(Breadboard board) {
    int checked = 0;
    for (Place place : board.places()) {
      if (place.sketch == null) {
        continue;
      }
      for (ClickableRegion region : place.sketch.regions) {
        validate(place, region);
        checked++;
      }
    }
    log.debug("Validated {} clickable regions ({} errors)", checked, errors.size());
    return errors;
  }

  // Returns the uniquely matched affordance, or null if the region is invalid
  Affordance validate(Place place, ClickableRegion region) {
    List<Affordance> matches = place.affordances.find(
        a -> !a.isInclude() && matching.matches(a.label, region.affordance));

    if (matches.size() != 1) {
      String found = matches.isEmpty() ? "no affordance" : matches.size() + " affordances";
      errors.add(new Diagnostic(DiagnosticKind.UNMATCHED_REGION,
          "Region " + region + " in place '" + place.name + "' matches " + found
              + " labelled '" + region.affordance + "'",
          region.location()));
      return null;
    }

    Affordance match = matches.get(0);
    if (!match.hasConnections()) {
      errors.add(new Diagnostic(DiagnosticKind.AFFORDANCE_WITHOUT_CONNECTION,
          "Affordance '" + match.label + "' in place '" + place.name + "' has no connection for its clickable region",
          region.location()));
      return null;
    }
    return match;
  }

  public List<Diagnostic> errors() {
    return errors;
  }
}
