package com.onthegomap.buildingtiles.store;

/** A failure querying the building store while the server is running. */
public class StoreException extends RuntimeException {

  public StoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
