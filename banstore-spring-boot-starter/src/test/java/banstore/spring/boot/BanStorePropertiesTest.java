package banstore.spring.boot;

import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import java.sql.Connection;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BanStorePropertiesTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withUserConfiguration(PropsConfig.class);

    @Test
    void defaultValues() {
        runner.run(ctx -> {
            var props = ctx.getBean(BanStoreProperties.class);
            assertEquals("ip_addresses", props.getTableName());
            assertTrue(props.isInitializeSchema());
            assertNull(props.getIsolation());
            assertTrue(props.getMetrics().isEnabled());
            assertEquals("banstore", props.getMetrics().getNamePrefix());
        });
    }

    @Test
    void customValues() {
        runner.withPropertyValues(
                "banstore.table-name=ssh_bans",
                "banstore.initialize-schema=false",
                "banstore.isolation=READ_COMMITTED",
                "banstore.metrics.enabled=false",
                "banstore.metrics.name-prefix=ssh.banstore"
        ).run(ctx -> {
            var props = ctx.getBean(BanStoreProperties.class);
            assertEquals("ssh_bans", props.getTableName());
            assertFalse(props.isInitializeSchema());
            assertEquals(Connection.TRANSACTION_READ_COMMITTED, props.getIsolation().level());
            assertFalse(props.getMetrics().isEnabled());
            assertEquals("ssh.banstore", props.getMetrics().getNamePrefix());
        });
    }

    @Configuration
    @EnableConfigurationProperties(BanStoreProperties.class)
    static class PropsConfig {
    }
}
