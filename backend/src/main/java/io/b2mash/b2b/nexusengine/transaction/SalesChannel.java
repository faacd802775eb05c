package io.b2mash.b2b.nexusengine.transaction;

/** Channel a sale was made through. */
public enum SalesChannel {
  DIRECT,
  MARKETPLACE
}
