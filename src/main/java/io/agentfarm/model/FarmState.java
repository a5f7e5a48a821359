package io.agentfarm.model;

import java.util.List;

/**
 * Everything the project store records, read in one pass.
 */
public record FarmState(
        ArchitectState architect,
        List<Builder> builders,
        List<UtilTerminal> utils,
        List<Annotation> annotations
) {
    public FarmState {
        builders = builders == null ? List.of() : List.copyOf(builders);
        utils = utils == null ? List.of() : List.copyOf(utils);
        annotations = annotations == null ? List.of() : List.copyOf(annotations);
    }

    public static FarmState empty() {
        return new FarmState(null, List.of(), List.of(), List.of());
    }
}
