package com.labtrace.lims.api;

import static org.assertj.core.api.Assertions.assertThat;

import org.assertj.core.api.InstanceOfAssertFactories;
import org.junit.jupiter.api.Test;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.test.util.ReflectionTestUtils;
import tech.jhipster.config.JHipsterConstants;

class ApplicationWebXmlTest {

    @Test
    void configureRegistersMainApplicationAndDefaultProfile() {
        SpringApplication application = new ApplicationWebXml().configure(new SpringApplicationBuilder()).build();

        assertThat(ReflectionTestUtils.getField(application, "primarySources"))
            .isNotNull()
            .asInstanceOf(InstanceOfAssertFactories.COLLECTION)
            .contains(LimsApiApp.class);
        assertThat(ReflectionTestUtils.getField(application, "defaultProperties"))
            .isNotNull()
            .asInstanceOf(InstanceOfAssertFactories.MAP)
            .containsEntry("spring.profiles.default", JHipsterConstants.SPRING_PROFILE_DEVELOPMENT);
    }
}
