package com.archforge.core.planner;

import com.archforge.core.model.ArchitectureModel;
import com.archforge.core.model.Relationship;
import com.archforge.core.model.RelationshipKind;
import com.archforge.core.model.SequenceStep;
import com.archforge.core.model.Unit;
import com.archforge.core.model.UnitKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.archforge.core.support.Units.entity;
import static com.archforge.core.support.Units.orderResource;
import static com.archforge.core.support.Units.unit;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link TaskPlanner}.
 */
class TaskPlannerTest {

    private TaskPlanner planner;

    @BeforeEach
    void setUp() {
        planner = new TaskPlanner();
    }

    @Test
    void plan_resource_ordersEveryDependencyBeforeItsDependent() {
        // When
        TaskPlan plan = planner.plan(orderResource("Future<number>"));

        // Then
        assertThat(plan.cycles()).isEmpty();
        assertThat(plan.order()).hasSize(plan.tasks().size());
        for (Task task : plan.tasks()) {
            int position = plan.order().indexOf(task.id());
            for (String dependency : task.dependencies()) {
                assertThat(plan.order().indexOf(dependency))
                    .as("%s before %s", dependency, task.id())
                    .isLessThan(position);
            }
        }
    }

    @Test
    void plan_resource_createsConventionalTasks() {
        // When
        TaskPlan plan = planner.plan(orderResource("Future<number>"));

        // Then
        assertThat(plan.findTask("backend_model_Order")).get()
            .extracting(Task::filePath).isEqualTo("backend/src/models/Order.ts");
        assertThat(plan.findTask("backend_service_OrderService").orElseThrow().dependencies())
            .contains("backend_model_Order");
        assertThat(plan.findTask("backend_controller_OrderController").orElseThrow().dependencies())
            .contains("backend_service_OrderService");
        assertThat(plan.findTask("backend_route_Order").orElseThrow().filePath())
            .isEqualTo("backend/src/routes/orderRoutes.ts");
        assertThat(plan.findTask("backend_server_entry").orElseThrow().dependencies())
            .containsExactly("backend_route_Order");
        assertThat(plan.findTask("test_unit_OrderService")).isPresent();
        assertThat(plan.findTask("test_integration")).isPresent();
        assertThat(plan.findTask("deploy_function").orElseThrow().filePath()).isEqualTo("serverless.yml");
        assertThat(plan.findTask("frontend_router")).isEmpty();
        assertThat(plan.warnings()).isEmpty();
    }

    @Test
    void plan_frontendUnits_addRouterE2eAndStaticSite() {
        // Given
        ArchitectureModel model = new ArchitectureModel("shop", List.of(
            entity("Order", List.of(), List.of()),
            Unit.of("OrderPage", UnitKind.UI_PAGE),
            Unit.of("OrderList", UnitKind.UI_COMPONENT)
        ), List.of(), List.of(), null);

        // When
        TaskPlan plan = planner.plan(model);

        // Then
        assertThat(plan.findTask("frontend_router").orElseThrow().dependencies())
            .containsExactly("frontend_page_OrderPage");
        assertThat(plan.findTask("test_e2e")).isPresent();
        assertThat(plan.findTask("build_frontend_package")).isPresent();
        assertThat(plan.findTask("deploy_static_site").orElseThrow().dependencies())
            .contains("build_frontend_package", "deploy_package");
        assertThat(plan.countByCategory().get(TaskCategory.FRONTEND)).isEqualTo(3);
    }

    @Test
    void plan_inheritanceCycle_excludesCycleAndBlockedTasks() {
        // Given
        ArchitectureModel model = new ArchitectureModel("cyclic", List.of(
            entity("A", List.of(), List.of()),
            entity("B", List.of(), List.of()),
            entity("C", List.of(), List.of()),
            entity("D", List.of(), List.of()),
            entity("E", List.of(), List.of())
        ), List.of(
            new Relationship("A", "B", RelationshipKind.INHERITANCE, null),
            new Relationship("B", "C", RelationshipKind.INHERITANCE, null),
            new Relationship("C", "A", RelationshipKind.REALIZATION, null),
            new Relationship("D", "A", RelationshipKind.COMPOSITION, null),
            new Relationship("E", "A", RelationshipKind.ASSOCIATION, null)
        ), List.of(), null);

        // When
        TaskPlan plan = planner.plan(model);

        // Then
        assertThat(plan.cycles()).hasSize(1);
        assertThat(plan.cycles().get(0).members())
            .containsExactlyInAnyOrder("backend_model_A", "backend_model_B", "backend_model_C");
        assertThat(plan.blocked()).contains("backend_model_D");
        assertThat(plan.order())
            .contains("backend_model_E", "shared_types", "deploy_function")
            .doesNotContain("backend_model_A", "backend_model_B", "backend_model_C", "backend_model_D");
        assertThat(plan.orderedTasks()).extracting(Task::id).isEqualTo(plan.order());
    }

    @Test
    void plan_sequenceCall_addsDependencyBetweenUnits() {
        // Given
        ArchitectureModel model = new ArchitectureModel("shop", List.of(
            entity("Order", List.of(), List.of()),
            unit("OrderRepository", UnitKind.REPOSITORY, List.of(), List.of(), List.of()),
            unit("OrderController", UnitKind.CONTROLLER, List.of(), List.of(), List.of())
        ), List.of(), List.of(
            new SequenceStep("OrderController", "OrderRepository", "findAll", List.of(), "Order[]"),
            new SequenceStep("Client", "OrderController", "list", List.of(), null)
        ), null);

        // When
        TaskPlan plan = planner.plan(model);

        // Then
        assertThat(plan.findTask("backend_controller_OrderController").orElseThrow().dependencies())
            .containsExactly("backend_model_Order", "backend_repository_OrderRepository");
        assertThat(plan.findTask("backend_repository_OrderRepository").orElseThrow().dependencies())
            .containsExactly("backend_model_Order");
    }
}
