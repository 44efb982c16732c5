package se.alipsa.jselect;

import java.util.List;

/**
 * Raised when options, schema or object location are invalid. Always surfaced
 * before any request is issued.
 */
public class ConfigurationException extends JSelectException {

  private static final long serialVersionUID = 1L;

  private final List<String> problems;

  /**
   * Create an exception for a single configuration problem.
   *
   * @param message
   *          description of the problem
   */
  public ConfigurationException(String message) {
    super(message);
    this.problems = List.of(message);
  }

  /**
   * Create an exception that reports several problems at once.
   *
   * @param problems
   *          every problem found while validating, must not be empty
   */
  public ConfigurationException(List<String> problems) {
    super(problems.size() == 1 ? problems.get(0)
        : "Invalid configuration: " + String.join("; ", problems));
    this.problems = List.copyOf(problems);
  }

  /**
   * The individual problems reported by this exception.
   *
   * @return immutable list of problem descriptions
   */
  public List<String> problems() {
    return problems;
  }
}
