package cn.gm.light.lscan;

import cn.gm.light.lscan.core.config.ScannerOptions;
import cn.gm.light.lscan.core.rpc.BoltLogClient;
import cn.gm.light.lscan.core.rpc.BoltLogServer;
import cn.gm.light.lscan.core.storage.MemoryLogStorage;
import cn.gm.light.lscan.entity.Endpoint;
import cn.gm.light.lscan.entity.LogEntry;
import com.alibaba.fastjson2.JSON;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;
import java.util.concurrent.CountDownLatch;

/**
 * @author 明溪
 * @version 1.0
 * @project logScanner
 * @description 命令行入口
 * <pre>
 *   App host:port [start] [end] [--print] [--config file]
 *   App --serve port entries
 * </pre>
 * @date 2025/4/5 20:11:36
 */
@Slf4j
public class App {
    private static final int RPC_TIMEOUT_MS = 3000;

    public static void main(String[] args) throws Exception {
        if (args.length == 0) {
            usage();
            return;
        }
        if ("--serve".equals(args[0])) {
            serve(args);
            return;
        }

        List<String> positional = new ArrayList<>();
        boolean print = false;
        Path configFile = null;
        for (int i = 0; i < args.length; i++) {
            if ("--print".equals(args[i])) {
                print = true;
            } else if ("--config".equals(args[i])) {
                if (i + 1 >= args.length) {
                    usage();
                    return;
                }
                configFile = Path.of(args[++i]);
            } else {
                positional.add(args[i]);
            }
        }
        if (positional.isEmpty()) {
            usage();
            return;
        }
        ScannerOptions options = ScannerOptions.fromProperties(loadProperties(configFile));
        Endpoint endpoint = new Endpoint(positional.get(0));
        BoltLogClient client = new BoltLogClient(endpoint, RPC_TIMEOUT_MS);
        client.init();
        try {
            Scanner scanner = Scanner.create(endpoint.getAddr(), client, options);
            long start = positional.size() > 1 ? Long.parseLong(positional.get(1)) : 0L;
            long end = positional.size() > 2 ? Long.parseLong(positional.get(2)) : scanner.treeSize();
            EntryHandler handler = print
                    ? (s, entry) -> printEntry(entry)
                    : (s, entry) -> log.debug("{}: entry {}", s.getLogId(), entry.getIndex());
            scanner.scan(start, end, handler);
            log.info("{}: scanned {} entries in [{}, {})", endpoint.getAddr(), scanner.getProcessed(), start, end);
        } finally {
            client.stop();
        }
    }

    private static synchronized void printEntry(LogEntry entry) {
        System.out.println(JSON.toJSONString(entry));
    }

    private static void serve(String[] args) throws InterruptedException {
        if (args.length < 3) {
            usage();
            return;
        }
        int port = Integer.parseInt(args[1]);
        long count = Long.parseLong(args[2]);
        MemoryLogStorage storage = new MemoryLogStorage();
        for (long i = 0; i < count; i++) {
            storage.append(new LogEntry[]{new LogEntry(("entry-" + i).getBytes(StandardCharsets.UTF_8))});
        }
        BoltLogServer server = new BoltLogServer(port, storage, 1000);
        server.start();
        CountDownLatch shutdown = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            server.stop();
            shutdown.countDown();
        }));
        shutdown.await();
    }

    static Properties loadProperties(Path override) throws IOException {
        Properties props = new Properties();
        try (InputStream in = App.class.getClassLoader().getResourceAsStream("scanner.properties")) {
            if (in != null) {
                props.load(in);
            }
        }
        if (override != null) {
            try (Reader reader = Files.newBufferedReader(override, StandardCharsets.UTF_8)) {
                props.load(reader);
            }
        }
        return props;
    }

    private static void usage() {
        log.info("usage: App host:port [start] [end] [--print] [--config file]");
        log.info("       App --serve port entries");
    }
}
