package io.chunkmesh.cli;

import io.chunkmesh.codec.ChunkCodec;
import io.chunkmesh.codec.FrameCodec;
import io.chunkmesh.config.ChunkMeshConfig;
import io.chunkmesh.config.EngineSettings;
import io.chunkmesh.ledger.TransferAbandonedException;
import io.chunkmesh.model.Frame;
import io.chunkmesh.model.NodeId;
import io.chunkmesh.model.ReceivedBinaryEvent;
import io.chunkmesh.model.Transfer;
import io.chunkmesh.model.TransferId;
import io.chunkmesh.runtime.SendOutcome;
import io.chunkmesh.runtime.TransferListener;
import io.chunkmesh.runtime.TransferRuntime;
import io.chunkmesh.transport.UdpTransportAdapter;
import io.chunkmesh.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeUnit;

@Command(
        name = "chunkmesh",
        mixinStandardHelpOptions = true,
        description = "ChunkMesh binary transfer node CLI",
        subcommands = {
                ChunkMeshCommand.NodeCommand.class,
                ChunkMeshCommand.FragmentCommand.class,
                ChunkMeshCommand.SettingsCommand.class
        }
)
public final class ChunkMeshCommand implements Runnable {

    @Option(names = {"--root"}, description = "Node data root directory", defaultValue = "data")
    String root;

    @Override
    public void run() {
        System.out.println("Use subcommands: node | fragment | settings");
    }

    ChunkMeshConfig config() {
        return ChunkMeshConfig.fromRoot(root);
    }

    @Command(name = "node", description = "Run a UDP mesh node, optionally sending one file")
    static final class NodeCommand implements Callable<Integer> {
        @ParentCommand
        ChunkMeshCommand parent;

        @Option(names = {"--id"}, required = true, description = "Node name or UUID")
        String id;

        @Option(names = {"--port"}, required = true, description = "UDP port to bind")
        int port;

        @Option(names = {"--peer"}, description = "Neighbour as name@host:port (repeatable)")
        List<String> peers = new ArrayList<>();

        @Option(names = {"--send"}, description = "File to send once the node is up")
        Path send;

        @Option(names = {"--type"}, description = "Type tag of the sent file", defaultValue = Transfer.DEFAULT_TYPE)
        String type;

        @Option(names = {"--to"}, description = "Recipient node name (omit to broadcast)")
        String to;

        @Option(names = {"--ttl"}, description = "Hop budget of the sent file (default from settings)")
        Integer ttl;

        @Option(names = {"--run-seconds"}, description = "How long to keep the node running", defaultValue = "10")
        long runSeconds;

        @Override
        public Integer call() throws Exception {
            List<UdpTransportAdapter.SeedEndpoint> seeds = new ArrayList<>();
            for (String raw : peers) {
                seeds.add(UdpTransportAdapter.parsePeer(raw));
            }
            NodeId self = NodeId.of(id);
            UdpTransportAdapter transport = new UdpTransportAdapter(self, port, seeds);
            try (TransferRuntime runtime = TransferRuntime.open(parent.config(), transport, new PrintingListener())) {
                runtime.start();
                if (send != null) {
                    byte[] payload = Files.readAllBytes(send);
                    NodeId recipient = to == null || to.isBlank() ? null : NodeId.of(to);
                    int hops = ttl == null ? runtime.settings().defaultTtl() : ttl;
                    SendOutcome sent = runtime.send(payload, type, recipient, hops).get(10, TimeUnit.SECONDS);
                    System.out.println(Jsons.toJson(sent));
                }
                Thread.sleep(Math.max(0L, runSeconds) * 1000L);
                System.out.println(Jsons.toJson(runtime.pendingSnapshot().get(10, TimeUnit.SECONDS)));
            }
            return 0;
        }
    }

    @Command(name = "fragment", description = "Print the frame plan of a file without sending it")
    static final class FragmentCommand implements Callable<Integer> {
        @ParentCommand
        ChunkMeshCommand parent;

        @Option(names = {"--file"}, required = true, description = "File to fragment")
        Path file;

        @Option(names = {"--mtu"}, description = "Payload bytes per frame (default from settings)")
        Integer mtu;

        @Option(names = {"--type"}, description = "Type tag", defaultValue = Transfer.DEFAULT_TYPE)
        String type;

        @Override
        public Integer call() throws Exception {
            byte[] payload = Files.readAllBytes(file);
            int effectiveMtu = mtu == null ? EngineSettings.load(parent.config().settingsFile()).mtu() : mtu;
            Transfer transfer = Transfer.broadcast(TransferId.random(), type, payload.length, ChunkCodec.DEFAULT_TTL);
            List<Frame> frames = ChunkCodec.fragment(payload, transfer, effectiveMtu);
            System.out.println(Jsons.toJson(plan(file, payload.length, effectiveMtu, frames)));
            return 0;
        }
    }

    @Command(name = "settings", description = "Print effective engine settings")
    static final class SettingsCommand implements Callable<Integer> {
        @ParentCommand
        ChunkMeshCommand parent;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(EngineSettings.load(parent.config().settingsFile())));
            return 0;
        }
    }

    static Map<String, Object> plan(Path file, int size, int mtu, List<Frame> frames) {
        Frame last = frames.get(frames.size() - 1);
        int header = FrameCodec.headerSize(last.originalType(), last.recipient() != null);
        long wireBytes = 0L;
        for (Frame frame : frames) {
            wireBytes += header + frame.payload().length;
        }
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("file", file.toString());
        out.put("size", size);
        out.put("mtu", mtu);
        out.put("totalChunks", frames.size());
        out.put("lastChunkBytes", last.payload().length);
        out.put("headerBytes", header);
        out.put("maxFrameBytes", header + frames.get(0).payload().length);
        out.put("wireBytes", wireBytes);
        return out;
    }

    static final class PrintingListener implements TransferListener {
        @Override
        public void onReceived(ReceivedBinaryEvent event) {
            System.out.println(Jsons.toJson(event));
        }

        @Override
        public void onCompleted(TransferId transferId) {
            System.out.println("Acknowledged: " + transferId);
        }

        @Override
        public void onAbandoned(TransferAbandonedException failure) {
            System.out.println("Abandoned: " + failure.getMessage());
        }

        @Override
        public void onStorageFailure(TransferId transferId, RuntimeException failure) {
            System.out.println("Storage failed for " + transferId + ": " + failure.getMessage());
        }
    }
}
