package com.github.processfsm;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A capability restriction installed by a bundle on the channels that were obtained through it.
 * Restrictions are inherited by every descendant of the bundle's body.
 */
final class Restriction {
  private final BundleMode mode;
  private final Set<ChannelName> channels;

  Restriction(final BundleMode mode, final Set<ChannelName> channels) {
    this.mode = mode;
    this.channels = Collections.unmodifiableSet(new LinkedHashSet<>(channels));
  }

  BundleMode getMode() {
    return mode;
  }

  Set<ChannelName> getChannels() {
    return channels;
  }

  boolean forbids(final ChannelName channel, final boolean sending) {
    if (!channels.contains(channel)) {
      return false;
    }
    return sending ? !mode.permitsSend() : !mode.permitsReceive();
  }

  @Override
  public String toString() {
    return "Restriction [mode=" + mode + ", channels=" + channels + "]";
  }
}
