package net.kili.client.util;

/** Stopwatch class used to measure how long a call, a wait or a connection has lasted. */
public class Stopwatch {
  private boolean isStarted = false;
  private long startTime;
  private long elapsedTime;

  /**
   * Creates a Stopwatch that is already running.
   *
   * @return a started Stopwatch
   */
  public static Stopwatch createStarted() {
    Stopwatch stopwatch = new Stopwatch();
    stopwatch.start();
    return stopwatch;
  }

  /**
   * Starts the Stopwatch.
   *
   * @throws IllegalStateException when Stopwatch is already running.
   */
  public void start() {
    if (isStarted) {
      throw new IllegalStateException("Stopwatch is already running");
    }

    isStarted = true;
    startTime = System.nanoTime();
  }

  /**
   * Stops the Stopwatch.
   *
   * @throws IllegalStateException when Stopwatch was not yet started or is already stopped.
   */
  public void stop() {
    if (!isStarted) {
      if (startTime == 0) {
        throw new IllegalStateException("Stopwatch has not been started");
      }
      throw new IllegalStateException("Stopwatch is already stopped");
    }

    isStarted = false;
    elapsedTime = System.nanoTime() - startTime;
  }

  /** Restarts the instance. */
  public void restart() {
    isStarted = true;
    startTime = System.nanoTime();
    elapsedTime = 0;
  }

  /**
   * Get the elapsed time (in ms). A running Stopwatch reports the time since it was started.
   *
   * @return elapsed milliseconds
   * @throws IllegalStateException when Stopwatch has not been started yet
   */
  public long elapsedMillis() {
    if (isStarted) {
      return (System.nanoTime() - startTime) / 1_000_000;
    }
    if (startTime == 0) {
      throw new IllegalStateException("Stopwatch has not been started");
    }
    return elapsedTime / 1_000_000;
  }

  public boolean isStarted() {
    return isStarted;
  }
}
