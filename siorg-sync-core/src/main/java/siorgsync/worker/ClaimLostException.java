package siorgsync.worker;

/**
 * A guarded queue write touched no row: the item is no longer PROCESSING under this
 * worker's claim token.
 */
public class ClaimLostException extends RuntimeException {
  private final String itemId;

  public ClaimLostException(String itemId) {
    super("Claim lost for sync queue item " + itemId);
    this.itemId = itemId;
  }

  public String itemId() {
    return itemId;
  }
}
