package com.modelgate.serving;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.modelgate.ModelGateException;
import com.modelgate.artifact.ModelLoadException;
import com.modelgate.registry.FileModelRegistry;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ActiveModelHandleTest {
    private static final String MODEL = "iris";

    @TempDir
    Path tempDir;

    @Test
    void shouldRefuseToPredictBeforeLoad() {
        ActiveModelHandle handle = new ActiveModelHandle(registry(), MODEL);

        assertFalse(handle.isLoaded());
        assertThrows(IllegalStateException.class, () -> handle.predict(List.<double[]>of(new double[] { 1.0 })));
    }

    @Test
    void shouldFailReloadWithoutProductionVersion() throws Exception {
        FileModelRegistry registry = registry();
        registry.register(MODEL, artifact("v1", 1.0));

        assertThrows(ModelGateException.class, () -> new ActiveModelHandle(registry, MODEL).reload());
    }

    @Test
    void shouldSwapToNewlyPromotedVersion() throws Exception {
        FileModelRegistry registry = registry();
        registry.register(MODEL, artifact("v1", 1.0));
        registry.register(MODEL, artifact("v2", -1.0));
        registry.promote(MODEL, 1L);
        ActiveModelHandle handle = new ActiveModelHandle(registry, MODEL);

        handle.reload();
        assertArrayEquals(new int[] { 0 }, handle.predict(List.<double[]>of(new double[] { 2.0 })));

        registry.promote(MODEL, 2L);
        handle.reload();
        assertEquals(2L, handle.current().version().version());
        assertArrayEquals(new int[] { 1 }, handle.predict(List.<double[]>of(new double[] { 2.0 })));
    }

    @Test
    void shouldKeepServingPreviousModelWhenReloadFails() throws Exception {
        FileModelRegistry registry = registry();
        registry.register(MODEL, artifact("v1", 1.0));
        Path broken = artifact("v2", 1.0);
        registry.register(MODEL, broken);
        registry.promote(MODEL, 1L);
        ActiveModelHandle handle = new ActiveModelHandle(registry, MODEL);
        handle.reload();

        Files.delete(broken.resolve("model.json"));
        registry.promote(MODEL, 2L);

        assertThrows(ModelLoadException.class, handle::reload);
        assertTrue(handle.isLoaded());
        assertEquals(1L, handle.current().version().version());
    }

    private FileModelRegistry registry() {
        return new FileModelRegistry(tempDir.resolve("model-registry.json"), "production");
    }

    private Path artifact(String name, double sign) throws Exception {
        Path directory = Files.createDirectories(tempDir.resolve(name));
        Files.writeString(directory.resolve("model.json"), "{\"format\":\"linear\",\"classes\":[0,1],"
                + "\"coefficients\":[[" + sign + "],[" + (-sign) + "]],\"intercepts\":[0.0,0.0]}");
        return directory;
    }
}
