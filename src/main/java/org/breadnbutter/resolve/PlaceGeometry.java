package org.breadnbutter.resolve;

import org.breadnbutter.model.Place;
import org.breadnbutter.model.Point;

/**
 * Sizes of places, and the fallback position of places that declare none. Implemented by
 * whatever lays the breadboard out on screen.
 */
public interface PlaceGeometry {

  double width(Place place);

  double height(Place place);

  // Automatic layout hook for places without a `position`
  default Point defaultPosition(Place place) {
    return Point.ORIGIN;
  }
}
