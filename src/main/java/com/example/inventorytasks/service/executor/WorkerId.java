package com.example.inventorytasks.service.executor;

import java.net.InetAddress;
import java.net.UnknownHostException;

/**
 * Name under which this process claims tasks, {@code host:pid}.
 */
final class WorkerId {

    private WorkerId() {
    }

    static String resolve() {
        var pid = ProcessHandle.current().pid();
        try {
            return InetAddress.getLocalHost().getHostName() + ":" + pid;
        } catch (UnknownHostException e) {
            var host = System.getenv().getOrDefault("HOSTNAME", "unknown-host");
            return host + ":" + pid;
        }
    }
}
