package com.github.processfsm;

/**
 * Capability restriction applied by a bundle to the channels obtained through it.
 */
public enum BundleMode {
  // bundle- : receive only
  READ(false, true),
  // bundle+ : send only
  WRITE(true, false),
  // bundle0 : neither
  EQUIV(false, false),
  // bundle : both
  RW(true, true);

  private final boolean sendAllowed;
  private final boolean receiveAllowed;

  private BundleMode(final boolean sendAllowed, final boolean receiveAllowed) {
    this.sendAllowed = sendAllowed;
    this.receiveAllowed = receiveAllowed;
  }

  public boolean permitsSend() {
    return sendAllowed;
  }

  public boolean permitsReceive() {
    return receiveAllowed;
  }
}
