package io.meshdispatch.transport;

import io.meshdispatch.TransportException;
import io.meshdispatch.spi.FrameListener;
import io.meshdispatch.spi.Transport;
import io.meshdispatch.util.DaemonThreadFactory;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link Transport} speaking newline-delimited JSON frames to a radio gateway over TCP.
 *
 * <p>A reader thread owns the connection: it connects, delivers every received line to
 * the {@link FrameListener}, and on any I/O error reconnects with exponential backoff.
 * Lines already read are delivered before the reconnect; a line longer than
 * {@link Builder#maxFrameBytes} is discarded. A writer thread drains a bounded send
 * buffer, so {@link #send(byte[])} never blocks; frames written while the link drops are
 * lost, which the reliable layer above compensates for.
 */
public final class TcpTransport implements Transport {
  private static final Logger logger = Logger.getLogger(TcpTransport.class.getName());

  public static final int DEFAULT_PORT = 4403;
  public static final int DEFAULT_MAX_FRAME_BYTES = 16 * 1024;

  private static final long WRITER_POLL_TIMEOUT_MS = 100;

  private final String host;
  private final int port;
  private final int connectTimeoutMs;
  private final long reconnectBaseDelayMs;
  private final long reconnectMaxDelayMs;
  private final int maxFrameBytes;
  private final BlockingQueue<byte[]> sendBuffer;

  private final Object socketLock = new Object();
  private Socket socket;
  private OutputStream out;
  private volatile boolean connected;
  private volatile boolean running;
  private ExecutorService threads;
  private FrameListener listener;

  private TcpTransport(Builder builder) {
    this.host = Objects.requireNonNull(builder.host, "host");
    if (builder.port <= 0 || builder.port > 65535) {
      throw new IllegalArgumentException("port out of range: " + builder.port);
    }
    if (builder.sendBufferCapacity <= 0) {
      throw new IllegalArgumentException("sendBufferCapacity must be > 0");
    }
    if (builder.reconnectBaseDelayMs <= 0 || builder.reconnectMaxDelayMs < builder.reconnectBaseDelayMs) {
      throw new IllegalArgumentException("invalid reconnect delays");
    }
    if (builder.maxFrameBytes <= 0) {
      throw new IllegalArgumentException("maxFrameBytes must be > 0");
    }
    this.maxFrameBytes = builder.maxFrameBytes;
    this.port = builder.port;
    this.connectTimeoutMs = builder.connectTimeoutMs;
    this.reconnectBaseDelayMs = builder.reconnectBaseDelayMs;
    this.reconnectMaxDelayMs = builder.reconnectMaxDelayMs;
    this.sendBuffer = new ArrayBlockingQueue<>(builder.sendBufferCapacity);
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public synchronized void start(FrameListener listener) {
    if (threads != null) {
      throw new IllegalStateException("TcpTransport already started");
    }
    this.listener = Objects.requireNonNull(listener, "listener");
    running = true;
    threads = Executors.newFixedThreadPool(2, new DaemonThreadFactory("mesh-dispatch-tcp-"));
    threads.submit(this::readerLoop);
    threads.submit(this::writerLoop);
  }

  @Override
  public void send(byte[] frame) {
    Objects.requireNonNull(frame, "frame");
    if (!connected) {
      throw new TransportException("Radio link " + host + ":" + port + " is down");
    }
    if (!sendBuffer.offer(frame)) {
      throw new TransportException("Send buffer full");
    }
  }

  @Override
  public boolean isConnected() {
    return connected;
  }

  private void readerLoop() {
    int failures = 0;
    while (running) {
      try {
        FrameReader reader = connect();
        failures = 0;
        logger.log(Level.INFO, "Connected to radio gateway {0}:{1}", new Object[]{host, String.valueOf(port)});
        byte[] line;
        while (running && (line = reader.next()) != null) {
          deliver(line);
        }
        if (running) {
          logger.warning("Radio gateway closed the connection");
        }
      } catch (IOException e) {
        if (running) {
          logger.log(Level.WARNING, "Radio link error: " + e.getMessage());
        }
      } catch (Throwable t) {
        logger.log(Level.SEVERE, "Radio reader loop error", t);
      } finally {
        disconnect();
      }
      if (running) {
        failures++;
        if (!pause(reconnectDelayMs(failures))) {
          return;
        }
      }
    }
  }

  private void deliver(byte[] line) {
    String trimmed = new String(line, StandardCharsets.UTF_8).trim();
    if (trimmed.isEmpty()) {
      return;
    }
    try {
      listener.onFrame(trimmed.getBytes(StandardCharsets.UTF_8));
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Frame listener failed", e);
    }
  }

  private void writerLoop() {
    while (running) {
      try {
        byte[] frame = sendBuffer.poll(WRITER_POLL_TIMEOUT_MS, TimeUnit.MILLISECONDS);
        if (frame == null) {
          continue;
        }
        write(frame);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        return;
      } catch (IOException e) {
        logger.log(Level.WARNING, "Radio write failed; frame dropped: " + e.getMessage());
        disconnect();
      } catch (Throwable t) {
        logger.log(Level.SEVERE, "Radio writer loop error", t);
      }
    }
  }

  private FrameReader connect() throws IOException {
    Socket s = new Socket();
    try {
      s.connect(new InetSocketAddress(host, port), connectTimeoutMs);
      s.setKeepAlive(true);
      s.setTcpNoDelay(true);
    } catch (IOException e) {
      s.close();
      throw e;
    }
    synchronized (socketLock) {
      socket = s;
      out = s.getOutputStream();
      connected = true;
    }
    return new FrameReader(new BufferedInputStream(s.getInputStream()), maxFrameBytes);
  }

  // single writer thread; disconnect() closing the socket unblocks a stalled write
  private void write(byte[] frame) throws IOException {
    OutputStream target;
    synchronized (socketLock) {
      target = out;
    }
    if (target == null) {
      logger.log(Level.FINE, "Link down; dropping queued frame");
      return;
    }
    target.write(frame);
    target.write('\n');
    target.flush();
  }

  private void disconnect() {
    synchronized (socketLock) {
      connected = false;
      out = null;
      if (socket != null) {
        try {
          socket.close();
        } catch (IOException e) {
          logger.log(Level.FINE, "Error closing radio socket", e);
        }
        socket = null;
      }
    }
  }

  long reconnectDelayMs(int failures) {
    int shift = Math.min(Math.max(failures - 1, 0), 20);
    long delay = reconnectBaseDelayMs << shift;
    return delay <= 0 ? reconnectMaxDelayMs : Math.min(delay, reconnectMaxDelayMs);
  }

  private boolean pause(long delayMs) {
    try {
      Thread.sleep(delayMs);
      return true;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }
  }

  @Override
  public synchronized void close() {
    running = false;
    disconnect();
    if (threads != null) {
      threads.shutdownNow();
      try {
        threads.awaitTermination(5, TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
    sendBuffer.clear();
  }

  /** Builder for {@link TcpTransport}. */
  public static final class Builder {
    private String host;
    private int port = DEFAULT_PORT;
    private int connectTimeoutMs = 5000;
    private long reconnectBaseDelayMs = 1000;
    private long reconnectMaxDelayMs = 30_000;
    private int sendBufferCapacity = 100;
    private int maxFrameBytes = DEFAULT_MAX_FRAME_BYTES;

    private Builder() {}

    /**
     * <p><b>Required.</b>
     */
    public Builder host(String host) {
      this.host = host;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@value TcpTransport#DEFAULT_PORT}.
     */
    public Builder port(int port) {
      this.port = port;
      return this;
    }

    public Builder connectTimeoutMs(int connectTimeoutMs) {
      this.connectTimeoutMs = connectTimeoutMs;
      return this;
    }

    /**
     * Sets the first reconnect delay; later ones double up to {@link #reconnectMaxDelayMs}.
     */
    public Builder reconnectBaseDelayMs(long reconnectBaseDelayMs) {
      this.reconnectBaseDelayMs = reconnectBaseDelayMs;
      return this;
    }

    public Builder reconnectMaxDelayMs(long reconnectMaxDelayMs) {
      this.reconnectMaxDelayMs = reconnectMaxDelayMs;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@code 100} frames.
     */
    public Builder sendBufferCapacity(int sendBufferCapacity) {
      this.sendBufferCapacity = sendBufferCapacity;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@value TcpTransport#DEFAULT_MAX_FRAME_BYTES} bytes per
     * received line.
     */
    public Builder maxFrameBytes(int maxFrameBytes) {
      this.maxFrameBytes = maxFrameBytes;
      return this;
    }

    public TcpTransport build() {
      return new TcpTransport(this);
    }
  }
}
