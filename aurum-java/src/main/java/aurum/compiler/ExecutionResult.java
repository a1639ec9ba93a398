package aurum.compiler;

import java.time.Duration;
import java.util.List;

// output still holds the lines printed before a runtime error
public record ExecutionResult(
        boolean success,
        List<String> output,
        List<String> errors,
        Duration elapsedTime
) {
    public ExecutionResult {
        output = List.copyOf(output);
        errors = List.copyOf(errors);
    }
}
