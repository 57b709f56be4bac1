package com.archforge.core.generator;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link CodeSanitizer}.
 */
class CodeSanitizerTest {

    @Test
    void sanitize_fencedBlockWithProse_keepsOnlyCode() {
        // Given
        String raw = "Sure! Here is the model you asked for:\n\n```typescript\nexport class Order {\n  id!: string;\n}\n```\n\nLet me know if you need more.";

        // When
        String result = CodeSanitizer.sanitize(raw, "backend/src/models/Order.ts");

        // Then
        assertThat(result).isEqualTo("export class Order {\n  id!: string;\n}\n");
    }

    @Test
    void sanitize_unfencedLeadingProse_isDroppedForScripts() {
        String raw = "Here you go.\nimport { Order } from '../models/Order';\nexport const x = 1;";

        String result = CodeSanitizer.sanitize(raw, "backend/src/services/OrderService.ts");

        assertThat(result).startsWith("import { Order }").endsWith("export const x = 1;\n");
    }

    @Test
    void sanitize_json_startsAtFirstBrace() {
        String raw = "The manifest:\n{\n  \"name\": \"shop\"\n}";

        String result = CodeSanitizer.sanitize(raw, "backend/package.json");

        assertThat(result).isEqualTo("{\n  \"name\": \"shop\"\n}\n");
    }

    @Test
    void sanitize_shellScript_keepsEverythingAfterFenceRemoval() {
        String raw = "#!/bin/sh\nset -e\nnpm ci\n";

        String result = CodeSanitizer.sanitize(raw, "scripts/build.sh");

        assertThat(result).isEqualTo(raw);
    }

    @Test
    void sanitize_cleanContent_isUnchanged() {
        String clean = "export class Order {}\n";

        assertThat(CodeSanitizer.sanitize(clean, "backend/src/models/Order.ts")).isEqualTo(clean);
        assertThat(CodeSanitizer.sanitize(CodeSanitizer.sanitize(clean, "a.ts"), "a.ts")).isEqualTo(clean);
    }

    @Test
    void sanitize_proseOnlyOrBlank_returnsEmpty() {
        assertThat(CodeSanitizer.sanitize("I cannot help with that.", "backend/src/models/Order.ts")).isEmpty();
        assertThat(CodeSanitizer.sanitize("   ", "backend/src/models/Order.ts")).isEmpty();
        assertThat(CodeSanitizer.sanitize(null, "backend/src/models/Order.ts")).isEmpty();
    }
}
