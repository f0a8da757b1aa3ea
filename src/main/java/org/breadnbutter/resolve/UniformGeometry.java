package org.breadnbutter.resolve;

import org.breadnbutter.model.Place;

// Every place gets the same size; undeclared places sit at the origin
public class UniformGeometry implements PlaceGeometry {
  private final double width;
  private final double height;

  public UniformGeometry(double width, double height) {
    if (width < 0 || height < 0) {
      throw new IllegalArgumentException("Place size cannot be negative: " + width + "x" + height);
    }
    this.width = width;
    this.height = height;
  }

  @Override
  public double width(Place place) {
    return width;
  }

  @Override
  public double height(Place place) {
    return height;
  }
}
