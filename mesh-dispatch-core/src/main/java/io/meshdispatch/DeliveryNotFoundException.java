package io.meshdispatch;

public class DeliveryNotFoundException extends DispatchException {
  private final long deliveryId;

  public DeliveryNotFoundException(long deliveryId) {
    super("Delivery not found: " + deliveryId);
    this.deliveryId = deliveryId;
  }

  public long deliveryId() {
    return deliveryId;
  }
}
