package com.archforge;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Command-line tests for {@link ArchForgeCLI} and its subcommands.
 */
@DisplayName("ArchForge CLI")
class ArchForgeCLITest {

    private static final String CLASS_DIAGRAM = """
        classDiagram
            class Order {
                +id: string
                +total(): number
            }
            class OrderService {
                +total(): Promise<number>
                +find(id: string): Promise<Order>
            }
            OrderService ..> Order
        """;

    @TempDir
    Path projectDir;

    @BeforeEach
    void setUp() throws Exception {
        Files.writeString(projectDir.resolve("archforge.yaml"), """
            project:
              name: shop
            output:
              directory: ./generated
            """);
        Path diagrams = Files.createDirectories(projectDir.resolve("diagrams/shop"));
        Files.writeString(diagrams.resolve("class.mmd"), CLASS_DIAGRAM);
    }

    @Test
    @DisplayName("validate succeeds for a parseable project")
    void validate_parseableProject_exitsZero() {
        int exitCode = execute("validate", projectDir.toString());

        assertThat(exitCode).isZero();
    }

    @Test
    @DisplayName("validate fails for a project without diagrams")
    void validate_unknownProjectId_exitsOne() {
        int exitCode = execute("validate", projectDir.toString(), "--project-id", "ghost");

        assertThat(exitCode).isEqualTo(1);
    }

    @Test
    @DisplayName("plan writes the task-plan record")
    void plan_writesPlanUnderOutputDirectory() throws Exception {
        // When
        int exitCode = execute("plan", projectDir.toString());

        // Then
        assertThat(exitCode).isZero();
        Path planFile = projectDir.resolve("generated/task-plan.json");
        assertThat(planFile).exists();
        assertThat(Files.readString(planFile)).contains("backend_model_Order");
    }

    @Test
    @DisplayName("plan honours an explicit plan file")
    void plan_explicitOutput_writesThere() {
        // Given
        Path target = projectDir.resolve("plans/shop.json");

        // When
        int exitCode = execute("plan", projectDir.toString(), "-o", target.toString());

        // Then
        assertThat(exitCode).isZero();
        assertThat(target).exists();
    }

    @Test
    @DisplayName("generate without a provider writes stubs and succeeds")
    void generate_noProvider_writesStubTree() throws Exception {
        // When
        int exitCode = execute("generate", projectDir.toString(), "--skip-validation", "--skip-deploy");

        // Then
        assertThat(exitCode).isZero();
        Path service = projectDir.resolve("generated/backend/src/services/OrderService.ts");
        assertThat(service).exists();
        assertThat(Files.readString(service))
            .contains("import { Order } from '../models/Order';")
            .contains("total(): Promise<number> {");
    }

    @Test
    @DisplayName("generate --dry-run writes only the plan")
    void generate_dryRun_writesOnlyPlan() {
        // When
        int exitCode = execute("generate", projectDir.toString(), "--dry-run");

        // Then
        assertThat(exitCode).isZero();
        assertThat(projectDir.resolve("generated/task-plan.json")).exists();
        assertThat(projectDir.resolve("generated/backend")).doesNotExist();
    }

    @Test
    @DisplayName("link is idempotent over a generated tree")
    void link_afterGenerate_exitsZeroAndKeepsContent() throws Exception {
        // Given
        Path output = projectDir.resolve("generated");
        execute("generate", projectDir.toString(), "--skip-validation", "--skip-deploy");
        Path service = output.resolve("backend/src/services/OrderService.ts");
        String before = Files.readString(service);

        // When
        int exitCode = execute("link", projectDir.toString(), "-o", output.toString());

        // Then
        assertThat(exitCode).isZero();
        assertThat(Files.readString(service)).isEqualTo(before);
    }

    @Test
    @DisplayName("link restores a drifted service signature from the diagrams")
    void link_driftedServiceSignature_isReconciledAgainstDiagrams() throws Exception {
        // Given
        execute("generate", projectDir.toString(), "--skip-validation", "--skip-deploy");
        Path service = projectDir.resolve("generated/backend/src/services/OrderService.ts");
        Files.writeString(service, Files.readString(service).replace("total(): Promise<number> {", "total(): string {"));

        // When
        int exitCode = execute("link", projectDir.toString());

        // Then
        assertThat(exitCode).isZero();
        assertThat(Files.readString(service))
            .contains("total(): Promise<number> {")
            .doesNotContain("total(): string {");
    }

    @Test
    @DisplayName("link without diagrams still links imports")
    void link_withoutDiagrams_linksImportsOnly() throws Exception {
        // Given
        execute("generate", projectDir.toString(), "--skip-validation", "--skip-deploy");
        Path service = projectDir.resolve("generated/backend/src/services/OrderService.ts");
        Files.writeString(service, Files.readString(service).replace("import { Order } from '../models/Order';\n", ""));

        // When
        int exitCode = execute("link", projectDir.toString(), "--project-id", "ghost",
            "-o", projectDir.resolve("generated").toString());

        // Then
        assertThat(exitCode).isZero();
        assertThat(Files.readString(service)).contains("import { Order } from '../models/Order';");
    }

    @Test
    @DisplayName("link fails for a missing output directory")
    void link_missingDirectory_exitsOne() {
        int exitCode = execute("link", projectDir.toString(), "-o", projectDir.resolve("nowhere").toString());

        assertThat(exitCode).isEqualTo(1);
    }

    @Test
    @DisplayName("unknown subcommands are rejected by the parser")
    void unknownCommand_exitsWithUsageError() {
        int exitCode = execute("deploy-everything");

        assertThat(exitCode).isEqualTo(2);
    }

    private static int execute(String... args) {
        return ArchForgeCLI.commandLine().execute(args);
    }
}
