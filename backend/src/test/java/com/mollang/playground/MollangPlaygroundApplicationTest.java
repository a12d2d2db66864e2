package com.mollang.playground;

import com.mollang.playground.config.MollangCompilerProperties;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class MollangPlaygroundApplicationTest {

    @Autowired
    MollangCompilerProperties properties;

    @Test
    void contextLoadsWithConfiguredProperties() {
        assertThat(properties.compilerPath()).isEqualTo("g++");
        assertThat(properties.compilerFlags()).containsExactly("-std=c++17");
        assertThat(properties.executionTimeoutMs()).isEqualTo(5000L);
        assertThat(properties.interpreterLimits().maxCallDepth()).isEqualTo(1000);
    }
}
