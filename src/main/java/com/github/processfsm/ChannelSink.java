package com.github.processfsm;

import java.util.List;

/**
 * Receives what is sent on a system channel. Sends on a channel with a sink never reach the
 * channel store; synchronous sends to it are acknowledged right away.
 */
public interface ChannelSink {
  String STDOUT = "rho:io:stdout";
  String STDERR = "rho:io:stderr";

  void write(ChannelName channel, List<Value> payload);
}
