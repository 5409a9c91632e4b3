package org.labrad.timing;

/**
 * The line of user code that created a node, kept so that errors found
 * much later in compilation can point back at it.
 *
 * Frames belonging to node classes (constructors, factory methods such as
 * {@code Output.constant}, and the same in device subclasses) are skipped.
 */
public final class CreationSite {
  private static final CreationSite UNKNOWN = new CreationSite(null);

  private final StackTraceElement frame;

  private CreationSite(StackTraceElement frame) {
    this.frame = frame;
  }

  /**
   * Capture the creation site of a node being constructed by the caller.
   */
  public static CreationSite capture() {
    for (StackTraceElement frame : new Throwable().getStackTrace()) {
      if (!isNodeFrame(frame)) {
        return new CreationSite(frame);
      }
    }
    return UNKNOWN;
  }

  private static boolean isNodeFrame(StackTraceElement frame) {
    if (frame.getClassName().equals(CreationSite.class.getName())) {
      return true;
    }
    Class<?> cls;
    try {
      cls = Class.forName(frame.getClassName(), false, CreationSite.class.getClassLoader());
    } catch (ClassNotFoundException ex) {
      // not visible from here, so it cannot be one of our nodes
      return false;
    }
    return Node.class.isAssignableFrom(cls);
  }

  public boolean isKnown() {
    return frame != null;
  }

  public String getClassName() {
    return frame == null ? null : frame.getClassName();
  }

  public String getMethodName() {
    return frame == null ? null : frame.getMethodName();
  }

  public String getFileName() {
    return frame == null ? null : frame.getFileName();
  }

  public int getLineNumber() {
    return frame == null ? -1 : frame.getLineNumber();
  }

  @Override
  public String toString() {
    return frame == null ? "<unknown>" : frame.toString();
  }
}
