package win.ixuni.s3probe.core.orchestrator;

import lombok.Value;

import java.util.Map;

/**
 * A failing check with its category, for reports
 */
@Value
public class FailedCheck {

    String category;

    String checkName;

    String message;

    Map<String, Object> details;

    double duration;
}
