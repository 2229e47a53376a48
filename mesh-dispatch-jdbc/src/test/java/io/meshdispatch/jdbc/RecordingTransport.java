package io.meshdispatch.jdbc;

import io.meshdispatch.TransportException;
import io.meshdispatch.spi.FrameListener;
import io.meshdispatch.spi.Transport;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/** Transport double that records sent frames and lets tests push inbound ones. */
public final class RecordingTransport implements Transport {
  private final List<String> sent = new CopyOnWriteArrayList<>();
  private volatile FrameListener listener;
  private volatile boolean connected = true;
  private volatile boolean closed;

  @Override
  public void start(FrameListener listener) {
    this.listener = listener;
  }

  @Override
  public void send(byte[] frame) {
    if (!connected) {
      throw new TransportException("link down");
    }
    sent.add(new String(frame, StandardCharsets.UTF_8));
  }

  @Override
  public boolean isConnected() {
    return connected;
  }

  public void setConnected(boolean connected) {
    this.connected = connected;
  }

  public void receive(String json) {
    listener.onFrame(json.getBytes(StandardCharsets.UTF_8));
  }

  public List<String> sent() {
    return sent;
  }

  public boolean isClosed() {
    return closed;
  }

  @Override
  public void close() {
    closed = true;
  }
}
