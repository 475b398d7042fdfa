package io.statewalk.serialization;

import com.fasterxml.jackson.databind.module.SimpleModule;
import io.statewalk.core.exception.StateMachineException;
import io.statewalk.core.execution.ExecutionWarning;
import io.statewalk.core.execution.result.PathResult;
import io.statewalk.core.model.MachineModel;
import io.statewalk.serialization.mixin.ExecutionWarningMixin;
import io.statewalk.serialization.mixin.PathResultMixin;
import java.io.Serial;

/// Jackson `SimpleModule` that registers all statewalk serialization configuration in one
/// place.
///
/// **Custom serializer/deserializer pairs**:
/// - `MachineModel`: `MachineModelJsonSerializer` / `MachineModelJsonDeserializer`, the
///   flattened node/edge document
/// - `StateMachineException`: `FailureSerializer`, written only
///
/// **Mixins**:
/// - `PathResult`: hides the derived `completed` flag, omits null fields
/// - `ExecutionWarning`: adds the read-only `message`
///
/// All other engine types (`HistoryEntry`, `AgentRequest`, `AgentResponse`,
/// `AgentInteraction`, `VisualizationSnapshot`) are records and bind through their
/// canonical constructors without further configuration.
///
/// @see MachineModelSerializer#createMapper() for the configured mapper
public class StatewalkJacksonModule extends SimpleModule {

    @Serial private static final long serialVersionUID = 3087415630928611842L;

    public StatewalkJacksonModule() {
        super("StatewalkJacksonModule");

        addSerializer(MachineModel.class, new MachineModelJsonSerializer());
        addDeserializer(MachineModel.class, new MachineModelJsonDeserializer());

        addSerializer(StateMachineException.class, new FailureSerializer());
    }

    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);

        context.setMixInAnnotations(PathResult.class, PathResultMixin.class);
        context.setMixInAnnotations(ExecutionWarning.class, ExecutionWarningMixin.class);
    }
}
