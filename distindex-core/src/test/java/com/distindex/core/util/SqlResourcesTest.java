package com.distindex.core.util;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class SqlResourcesTest {

    @Test
    void statements_splitsScriptAndDropsComments() {
        List<String> statements = SqlResources.statements("schema/staging.sql");

        assertThat(statements)
            .isNotEmpty()
            .allSatisfy(statement -> {
                assertThat(statement).doesNotStartWith("--");
                assertThat(statement).doesNotEndWith(";");
            })
            .anySatisfy(statement -> assertThat(statement).contains("t_author"));
    }

    @Test
    void load_returnsCachedText() {
        assertThat(SqlResources.load("resolve/dependency.sql"))
            .isSameAs(SqlResources.load("resolve/dependency.sql"));
    }

    @Test
    void load_withUnknownResource_throwsException() {
        assertThatThrownBy(() -> SqlResources.load("nope/missing.sql"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("sql/nope/missing.sql");
    }
}
