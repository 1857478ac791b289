package ai.mapper.io;

import java.util.List;

/**
 * A generated map that references components it never declares, or lacks a required section.
 */
public class InvalidMapException extends Exception {

    private static final int SHOWN = 3;

    private final List<String> problems;

    public InvalidMapException(List<String> problems) {
        super(problems.size() + " problem(s): "
                + String.join("; ", problems.subList(0, Math.min(SHOWN, problems.size()))));
        this.problems = List.copyOf(problems);
    }

    public List<String> problems() {
        return problems;
    }
}
