package com.archforge.core.linking;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ImportStatement}.
 */
class ImportStatementTest {

    @Test
    void parse_namedWithAlias_bindsLocalNames() {
        ImportStatement statement = ImportStatement.parse("import { A, B as C } from './x';").orElseThrow();

        assertThat(statement.named()).containsExactly("A", "B as C");
        assertThat(statement.boundNames()).containsExactly("A", "C");
        assertThat(statement.format()).isEqualTo("import { A, B as C } from './x';");
    }

    @Test
    void parse_defaultAndNamed_keepsBoth() {
        ImportStatement statement = ImportStatement.parse("import React, { useState } from 'react';").orElseThrow();

        assertThat(statement.defaultName()).isEqualTo("React");
        assertThat(statement.named()).containsExactly("useState");
        assertThat(statement.format()).isEqualTo("import React, { useState } from 'react';");
    }

    @Test
    void parse_namespace_bindsNamespace() {
        ImportStatement statement = ImportStatement.parse("import * as path from \"path\"").orElseThrow();

        assertThat(statement.namespace()).isEqualTo("path");
        assertThat(statement.source()).isEqualTo("path");
        assertThat(statement.format()).isEqualTo("import * as path from 'path';");
    }

    @Test
    void parse_typeOnly_isPreservedOnFormat() {
        ImportStatement statement = ImportStatement.parse("import type { Order } from '../models/Order';").orElseThrow();

        assertThat(statement.typeOnly()).isTrue();
        assertThat(statement.format()).isEqualTo("import type { Order } from '../models/Order';");
    }

    @Test
    void parse_sideEffect_bindsNothing() {
        ImportStatement statement = ImportStatement.parse("import './styles.css';").orElseThrow();

        assertThat(statement.sideEffect()).isTrue();
        assertThat(statement.boundNames()).isEmpty();
        assertThat(statement.isEmpty()).isFalse();
        assertThat(statement.format()).isEqualTo("import './styles.css';");
    }

    @Test
    void parse_multiLineNamedList_isJoined() {
        ImportStatement statement = ImportStatement.parse("import {\n  Order,\n  OrderStatus,\n} from '../models/Order';")
            .orElseThrow();

        assertThat(statement.named()).containsExactly("Order", "OrderStatus");
    }

    @Test
    void parse_notAnImport_isEmpty() {
        assertThat(ImportStatement.parse("const x = 1;")).isEmpty();
        assertThat(ImportStatement.parse("import from 'x';")).isEmpty();
    }

    @Test
    void withNamed_emptyList_makesStatementEmpty() {
        ImportStatement statement = ImportStatement.named("./x", List.of("A")).withNamed(List.of());

        assertThat(statement.isEmpty()).isTrue();
    }

    @Test
    void localName_handlesAliasAndTypeModifier() {
        assertThat(ImportStatement.localName("B as C")).isEqualTo("C");
        assertThat(ImportStatement.localName("type Order")).isEqualTo("Order");
        assertThat(ImportStatement.localName("A")).isEqualTo("A");
    }
}
