package com.archforge.core.linking;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ReferencePathResolver}.
 */
class ReferencePathResolverTest {

    private static final String SERVICE = "backend/src/services/OrderService.ts";

    private ReferencePathResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new ReferencePathResolver();
    }

    @Test
    void resolve_relativeSpecifier_isResolvedAgainstFileDirectory() {
        assertThat(resolver.resolve(SERVICE, "../models/Order")).contains("backend/src/models/Order");
        assertThat(resolver.resolve(SERVICE, "./PaymentService")).contains("backend/src/services/PaymentService");
    }

    @Test
    void resolve_alias_isSubstitutedUnderPackageRoot() {
        assertThat(resolver.resolve(SERVICE, "@/models/Order")).contains("backend/src/models/Order");
        assertThat(resolver.resolve("frontend/src/pages/OrderPage.tsx", "@/components/OrderList"))
            .contains("frontend/src/components/OrderList");
    }

    @Test
    void resolve_longestAliasWins() {
        Map<String, String> aliases = new LinkedHashMap<>();
        aliases.put("@/", "src/");
        aliases.put("@/lib/", "lib/");
        ReferencePathResolver custom = new ReferencePathResolver(aliases);

        assertThat(custom.resolve("frontend/src/App.tsx", "@/lib/format")).contains("frontend/lib/format");
    }

    @Test
    void resolve_externalPackage_isEmpty() {
        assertThat(resolver.resolve(SERVICE, "express")).isEmpty();
        assertThat(resolver.isLocal("express")).isFalse();
        assertThat(resolver.isLocal("../models/Order")).isTrue();
    }

    @Test
    void matchKnownFile_triesExtensionsThenIndex() {
        Set<String> known = Set.of("backend/src/models/Order.ts", "shared/src/types/index.ts");

        assertThat(resolver.matchKnownFile("backend/src/models/Order", known)).contains("backend/src/models/Order.ts");
        assertThat(resolver.matchKnownFile("shared/src/types", known)).contains("shared/src/types/index.ts");
        assertThat(resolver.matchKnownFile("backend/src/models/Missing", known)).isEmpty();
    }

    @Test
    void specifierFor_computesRelativeSpecifier() {
        assertThat(resolver.specifierFor(SERVICE, "backend/src/models/Order.ts")).isEqualTo("../models/Order");
        assertThat(resolver.specifierFor(SERVICE, "backend/src/services/PaymentService.ts")).isEqualTo("./PaymentService");
        assertThat(resolver.specifierFor(SERVICE, "shared/src/types/index.ts")).isEqualTo("../../../shared/src/types");
    }

    @Test
    void specifierFor_resolvesBackToTarget() {
        String target = "backend/src/models/Order.ts";
        String specifier = resolver.specifierFor(SERVICE, target);

        String resolved = resolver.resolve(SERVICE, specifier).orElseThrow();

        assertThat(resolver.matchKnownFile(resolved, Set.of(target))).contains(target);
    }
}
