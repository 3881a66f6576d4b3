package io.notebookhive.converter.render;

/**
 * A diagram could not be rendered. The message is reported back to the dispatcher as the failure
 * reason, so it should read well on its own.
 */
public class RenderException extends Exception {

  public RenderException(String message) {
    super(message);
  }

  public RenderException(String message, Throwable cause) {
    super(message, cause);
  }
}
