package io.b2mash.b2b.inteltask.collectionpoint;

/** Default dispatch frequency a collection point carries for point-default templates. */
public enum PointFrequencyType {
  DAILY,
  WEEKLY,
  MONTHLY,
  CUSTOM
}
