package com.controlplane.api.rest;

import com.controlplane.core.model.CloudAccount;
import com.controlplane.core.model.CloudProvider;
import com.controlplane.core.model.ClusterProfile;
import com.controlplane.core.model.Kube;
import com.controlplane.core.model.NodeProfile;
import com.controlplane.core.model.NodeRole;
import com.controlplane.core.model.NodeSpec;
import com.controlplane.core.model.StepStatus;
import com.controlplane.core.model.Task;
import com.controlplane.core.model.TaskStatus;
import com.controlplane.core.exception.NotFoundException;
import com.controlplane.core.exception.ValidationException;
import com.controlplane.core.repository.CloudAccountRepository;
import com.controlplane.engine.execution.TaskRun;
import com.controlplane.engine.service.ClusterLifecycleService;
import com.controlplane.engine.service.ClusterService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST API for clusters and the tasks that operate on them.
 */
@RestController
@RequestMapping("/api/v1/kubes")
public class KubeController {

    private final ClusterService clusterService;
    private final ClusterLifecycleService lifecycleService;
    private final CloudAccountRepository accountRepository;

    public KubeController(ClusterService clusterService,
                          ClusterLifecycleService lifecycleService,
                          CloudAccountRepository accountRepository) {
        this.clusterService = clusterService;
        this.lifecycleService = lifecycleService;
        this.accountRepository = accountRepository;
    }

    /**
     * Register an existing cluster.
     */
    @PostMapping
    public ResponseEntity<KubeResponse> createKube(@Valid @RequestBody CreateKubeRequest request) {
        CloudAccount account = accountRepository.findByName(request.accountName())
            .orElseThrow(() -> new NotFoundException("CloudAccount", request.accountName()));
        if (request.provider() != null && request.provider() != account.provider()) {
            throw new ValidationException("provider",
                "account " + account.name() + " belongs to " + account.provider());
        }

        Kube kube = clusterService.create(request.toKube(account.provider()));
        return ResponseEntity.status(HttpStatus.CREATED).body(KubeResponse.from(kube));
    }

    @GetMapping
    public ResponseEntity<List<KubeResponse>> listKubes() {
        return ResponseEntity.ok(clusterService.list().stream()
            .map(KubeResponse::from)
            .toList());
    }

    @GetMapping("/{name}")
    public ResponseEntity<KubeResponse> getKube(@PathVariable String name) {
        return ResponseEntity.ok(KubeResponse.from(clusterService.get(name)));
    }

    /**
     * Tear the cluster down. The record disappears once the task succeeds.
     */
    @DeleteMapping("/{name}")
    public ResponseEntity<TaskAccepted> deleteKube(@PathVariable String name) {
        TaskRun run = lifecycleService.deleteCluster(name);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(new TaskAccepted(List.of(run.taskId())));
    }

    @GetMapping("/{name}/tasks")
    public ResponseEntity<List<TaskResponse>> listTasks(@PathVariable String name) {
        return ResponseEntity.ok(lifecycleService.clusterTasks(name).stream()
            .map(TaskResponse::from)
            .toList());
    }

    /**
     * Provision one node per requested profile.
     */
    @PostMapping("/{name}/nodes")
    public ResponseEntity<TaskAccepted> addNodes(@PathVariable String name,
                                                 @Valid @RequestBody AddNodesRequest request) {
        List<NodeProfile> profiles = request.nodes().stream()
            .map(NodeProfileDto::toProfile)
            .toList();
        List<String> taskIds = lifecycleService.addNodes(name, profiles);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(new TaskAccepted(taskIds));
    }

    @DeleteMapping("/{name}/nodes/{nodeName}")
    public ResponseEntity<TaskAccepted> deleteNode(@PathVariable String name, @PathVariable String nodeName) {
        TaskRun run = lifecycleService.deleteNode(name, nodeName);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(new TaskAccepted(List.of(run.taskId())));
    }

    // ========== DTOs ==========

    public record CreateKubeRequest(
        @NotBlank String name,
        @NotBlank String accountName,
        CloudProvider provider,
        @NotNull ClusterProfile profile,
        @NotEmpty List<@Valid NodeDto> masters,
        List<@Valid NodeDto> nodes
    ) {
        Kube toKube(CloudProvider accountProvider) {
            return new Kube(name, accountName, accountProvider, profile,
                index(masters, NodeRole.MASTER), index(nodes, NodeRole.WORKER));
        }

        private static Map<String, NodeSpec> index(List<NodeDto> dtos, NodeRole role) {
            Map<String, NodeSpec> byName = new LinkedHashMap<>();
            if (dtos != null) {
                dtos.forEach(dto -> byName.put(dto.name(), dto.toSpec(role)));
            }
            return byName;
        }
    }

    public record NodeDto(
        @NotBlank String name,
        String providerId,
        String region,
        String privateIp,
        String publicIp
    ) {
        NodeSpec toSpec(NodeRole role) {
            return new NodeSpec(name, providerId, role, region, privateIp, publicIp);
        }
    }

    public record AddNodesRequest(@NotEmpty List<@Valid NodeProfileDto> nodes) {}

    public record NodeProfileDto(@NotBlank String size, String image, NodeRole role) {
        NodeProfile toProfile() {
            return new NodeProfile(size, image, role);
        }
    }

    public record TaskAccepted(List<String> taskIds) {}

    public record KubeResponse(
        String name,
        String accountName,
        CloudProvider provider,
        ClusterProfile profile,
        List<NodeSpec> masters,
        List<NodeSpec> nodes
    ) {
        static KubeResponse from(Kube kube) {
            return new KubeResponse(kube.name(), kube.accountName(), kube.provider(), kube.profile(),
                List.copyOf(kube.masters().values()), List.copyOf(kube.nodes().values()));
        }
    }

    public record TaskResponse(
        String id,
        String type,
        TaskStatus status,
        List<StepStatus> stepStatuses,
        String nodeName,
        Instant createdAt,
        Instant completedAt
    ) {
        static TaskResponse from(Task task) {
            String node = task.config() != null && task.config().node() != null
                ? task.config().node().name()
                : null;
            return new TaskResponse(task.id(), task.workflowKind(), task.status(), task.stepStatuses(),
                node, task.createdAt(), task.completedAt());
        }
    }
}
