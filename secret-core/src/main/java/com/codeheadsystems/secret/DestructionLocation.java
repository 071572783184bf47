package com.codeheadsystems.secret;

import com.codeheadsystems.secret.effect.SecretEffects;
import java.util.Optional;
import java.util.Set;

/**
 * The caller that destroyed a secret, reported by {@link SecretNoLongerValidException} to make
 * "used after destroy" bugs easy to track down.
 *
 * @param className  the class name
 * @param methodName the method name
 * @param fileName   the file name, may be null
 * @param lineNumber the line number, negative when unknown
 */
public record DestructionLocation(String className, String methodName, String fileName, int lineNumber) {

  private static final Set<String> INTERNAL = Set.of(
      SecretApi.class.getName(),
      Secret.class.getName(),
      OneShotSecret.class.getName(),
      DestructionLocation.class.getName(),
      SecretEffects.class.getName());

  /**
   * The first stack frame outside of the secret classes.
   *
   * @return the destruction location
   */
  static Optional<DestructionLocation> capture() {
    return StackWalker.getInstance().walk(frames -> frames
        .filter(frame -> !isInternal(frame.getClassName()))
        .findFirst()
        .map(frame -> new DestructionLocation(
            frame.getClassName(), frame.getMethodName(), frame.getFileName(), frame.getLineNumber())));
  }

  private static boolean isInternal(String className) {
    int nested = className.indexOf('$');
    return INTERNAL.contains(nested < 0 ? className : className.substring(0, nested));
  }

  @Override
  public String toString() {
    return className + "." + methodName + "(" + (fileName == null ? "Unknown Source" : fileName)
        + (lineNumber >= 0 ? ":" + lineNumber : "") + ")";
  }
}
