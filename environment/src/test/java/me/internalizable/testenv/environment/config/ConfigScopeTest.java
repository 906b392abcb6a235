package me.internalizable.testenv.environment.config;

import me.internalizable.testenv.api.EffectiveConfig;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConfigScopeTest {

    private static EffectiveConfig config() {
        EffectiveConfig.Builder builder = EffectiveConfig.builder();
        for (String scheme : EffectiveConfig.BASELINE_SCHEMES) {
            builder.ports(scheme, List.of(1));
        }
        return builder.build();
    }

    @Test
    void deletesWorkDirectoryOnClose() throws Exception {
        ConfigScope scope = ConfigScope.open(config());
        Path dir = scope.getWorkDirectory();
        Files.createDirectories(dir.resolve("logs"));
        Files.writeString(dir.resolve("logs").resolve("http-8000.log"), "started");

        scope.close();

        assertTrue(scope.isClosed());
        assertFalse(Files.exists(dir));
        assertThrows(IllegalStateException.class, scope::getWorkDirectory);
    }
}
