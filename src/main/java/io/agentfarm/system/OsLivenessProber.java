package io.agentfarm.system;

import io.agentfarm.config.FarmConfig;

import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.nio.file.Files;
import java.nio.file.Path;

public final class OsLivenessProber implements LivenessProber {

    @Override
    public boolean isPidAlive(long pid) {
        if (pid <= 0) {
            return false;
        }
        return ProcessHandle.of(pid).map(ProcessHandle::isAlive).orElse(false);
    }

    @Override
    public boolean pathExists(Path path) {
        return path != null && Files.exists(path);
    }

    @Override
    public boolean isPortFree(int port) {
        try (ServerSocket socket = new ServerSocket()) {
            socket.setReuseAddress(false);
            socket.bind(new InetSocketAddress(InetAddress.getByName(FarmConfig.LOCALHOST), port));
            return true;
        } catch (IOException e) {
            return false;
        }
    }
}
