package com.example.campaign.admin.config;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.config.YamlPropertiesFactoryBean;
import org.springframework.core.io.ClassPathResource;

import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;

class AdminApplicationYamlTest {

    @Test
    void exposesOnlyEndpointsBackedByDeclaredDependencies() {
        Properties properties = load();

        assertThat(properties.getProperty("management.endpoints.web.exposure.include"))
                .isEqualTo("health,info,metrics");
    }

    @Test
    void audienceCountLimiterRejectsInsteadOfWaiting() {
        Properties properties = load();

        assertThat(properties.getProperty("resilience4j.ratelimiter.instances.audienceCountLimiter.limit-for-period"))
                .isEqualTo("20");
        assertThat(properties.getProperty("resilience4j.ratelimiter.instances.audienceCountLimiter.timeout-duration"))
                .isEqualTo("0");
    }

    private static Properties load() {
        YamlPropertiesFactoryBean yaml = new YamlPropertiesFactoryBean();
        yaml.setResources(new ClassPathResource("application.yml"));
        return yaml.getObject();
    }
}
