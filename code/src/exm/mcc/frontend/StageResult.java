package exm.mcc.frontend;

import com.google.common.base.Preconditions;

import exm.mcc.common.exceptions.MCCRuntimeError;
import exm.mcc.common.exceptions.UserException;

/**
 * Outcome of one front end stage: either a value or the single error
 * that stopped the stage.
 * @param <T> type of value on success
 */
public class StageResult<T> {
  private final T value;
  private final UserException error;

  private StageResult(T value, UserException error) {
    this.value = value;
    this.error = error;
  }

  public static <T> StageResult<T> success(T value) {
    return new StageResult<T>(value, null);
  }

  public static <T> StageResult<T> failure(UserException error) {
    return new StageResult<T>(null, Preconditions.checkNotNull(error));
  }

  public boolean isSuccess() {
    return error == null;
  }

  /**
   * @return the value; only valid on success
   */
  public T getValue() {
    if (error != null) {
      throw new MCCRuntimeError("No value for failed stage: "
                                + error.getMessage());
    }
    return value;
  }

  /**
   * @return the error, or null on success
   */
  public UserException getError() {
    return error;
  }

  /**
   * Unwrap back into exception form
   */
  public T getOrThrow() throws UserException {
    if (error != null) {
      throw error;
    }
    return value;
  }

  @Override
  public String toString() {
    return isSuccess() ? "success: " + value : "failure: " + error.getMessage();
  }
}
