package io.statewalk.core.context;

import static io.statewalk.core.TestModels.context;
import static io.statewalk.core.TestModels.withAttributes;
import static org.assertj.core.api.Assertions.assertThat;

import io.statewalk.core.model.MachineModel;
import io.statewalk.core.model.NodeKind;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class SharedAttributeStoreTest {

    @Test
    void shouldSeedDeclaredValuesAndSkipUnsetAttributes() {
        MachineModel model =
                MachineModel.builder("m")
                        .node(withAttributes("worker", NodeKind.STATE, "retries", 2, "result", null))
                        .node(context("config", "mode", "fast"))
                        .build();

        SharedAttributeStore store = SharedAttributeStore.seededFrom(model);

        assertThat(store.get("worker.retries")).contains(2);
        assertThat(store.get("config", "mode")).contains("fast");
        assertThat(store.contains("worker.result")).isFalse();
        assertThat(store.revision()).isZero();
    }

    @Test
    void shouldUnsetAttributeWhenPuttingNull() {
        SharedAttributeStore store = new SharedAttributeStore();
        store.put("ctx", "value", 1);

        store.put("ctx", "value", null);

        assertThat(store.contains("ctx.value")).isFalse();
        assertThat(store.revision()).isEqualTo(2);
    }

    @Test
    void shouldOnlyBumpRevisionOnChange() {
        SharedAttributeStore store = new SharedAttributeStore();

        store.put("ctx", "value", "same");
        store.put("ctx", "value", "same");

        assertThat(store.revision()).isEqualTo(1);
    }

    @Test
    void shouldReturnValuesOfOneNodeOnly() {
        SharedAttributeStore store = new SharedAttributeStore();
        Map<String, Object> updates = new LinkedHashMap<>();
        updates.put("a", 1);
        updates.put("b", "two");
        store.putAll("ctx", updates);
        store.put("ctxOther", "a", 3);

        assertThat(store.valuesOf("ctx")).containsExactly(Map.entry("a", 1), Map.entry("b", "two"));
        assertThat(store.snapshot()).containsOnlyKeys("ctx.a", "ctx.b", "ctxOther.a");
    }
}
