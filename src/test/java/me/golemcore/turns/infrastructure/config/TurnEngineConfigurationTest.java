package me.golemcore.turns.infrastructure.config;

import me.golemcore.turns.domain.loop.AgentRunner;
import me.golemcore.turns.domain.loop.RunStateSerializer;
import me.golemcore.turns.domain.system.turn.TurnResolver;
import me.golemcore.turns.port.outbound.ModelPort;
import me.golemcore.turns.port.outbound.SessionPort;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.time.Duration;
import java.util.concurrent.ExecutorService;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;

class TurnEngineConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withUserConfiguration(TurnEngineConfiguration.class)
            .withBean(ModelPort.class, () -> mock(ModelPort.class));

    @Test
    void shouldWireEngineAroundProvidedModelPort() {
        contextRunner.run(context -> {
            assertNotNull(context.getBean(AgentRunner.class));
            assertNotNull(context.getBean(TurnResolver.class));
            assertNotNull(context.getBean(RunStateSerializer.class));
            assertNotNull(context.getBean(SessionPort.class));
        });
    }

    @Test
    void shouldBindTurnProperties() {
        contextRunner
                .withPropertyValues("turns.runner.max-turns=3", "turns.dispatch.action-timeout=30s",
                        "turns.output.schema-error-max-length=80")
                .run(context -> {
                    TurnEngineProperties properties = context.getBean(TurnEngineProperties.class);
                    assertEquals(3, properties.getRunner().getMaxTurns());
                    assertEquals(Duration.ofSeconds(30), properties.getDispatch().getActionTimeout());
                    assertEquals(80, properties.getOutput().getSchemaErrorMaxLength());
                });
    }

    @Test
    void shouldShutDownDispatchExecutorWithContext() {
        ExecutorService[] executor = new ExecutorService[1];

        contextRunner.run(context -> executor[0] = context.getBean("turnDispatchExecutor", ExecutorService.class));

        assertTrue(executor[0].isShutdown());
    }

    @Test
    void shouldUseDefaultsWithoutProperties() {
        TurnEngineProperties properties = new TurnEngineProperties();

        assertEquals(10, properties.getRunner().getMaxTurns());
        assertEquals(Duration.ofMinutes(5), properties.getDispatch().getActionTimeout());
        assertEquals(0, properties.getDispatch().getPoolSize());
        assertEquals(160, properties.getOutput().getSchemaErrorMaxLength());
    }
}
