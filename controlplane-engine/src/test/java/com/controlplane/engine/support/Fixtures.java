package com.controlplane.engine.support;

import com.controlplane.core.model.CloudAccount;
import com.controlplane.core.model.CloudProvider;
import com.controlplane.core.model.ClusterProfile;
import com.controlplane.core.model.Kube;
import com.controlplane.core.model.NodeRole;
import com.controlplane.core.model.NodeSpec;
import com.controlplane.core.model.TaskConfig;

import java.util.Map;

public final class Fixtures {

    public static final String ACCOUNT = "do-main";
    public static final String SECRET = "dop_v1_secret_token";

    private Fixtures() {
    }

    public static CloudAccount account() {
        return new CloudAccount(ACCOUNT, CloudProvider.DIGITALOCEAN, Map.of("token", SECRET));
    }

    public static ClusterProfile profile() {
        return new ClusterProfile("fra1", "1.28.2", "ubuntu-22.04", "24.0", "calico", "10.0.0.0/16", true);
    }

    public static NodeSpec master(String name) {
        return new NodeSpec(name, "do-" + name, NodeRole.MASTER, "fra1", "10.0.0.2", "203.0.113.2");
    }

    public static NodeSpec worker(String name) {
        return new NodeSpec(name, "do-" + name, NodeRole.WORKER, "fra1", "10.0.0.3", "203.0.113.3");
    }

    public static Kube kube(String name) {
        return new Kube(name, ACCOUNT, CloudProvider.DIGITALOCEAN, profile(),
            Map.of(name + "-master-1", master(name + "-master-1")),
            Map.of(name + "-worker-1", worker(name + "-worker-1")));
    }

    public static TaskConfig config(String clusterName) {
        return TaskConfig.forCluster(kube(clusterName), account());
    }
}
