package org.muma.respkv;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.muma.respkv.config.ServerConfig;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 真实端口上的端到端测试，客户端直接用 Socket 收发 RESP
 */
class RespKvServerIntegrationTest {

    private RespKvServer server;

    @BeforeEach
    void setUp() throws InterruptedException {
        server = startServer(64, 5000);
    }

    @AfterEach
    void tearDown() {
        server.stop();
    }

    private static RespKvServer startServer(int maxClients, long permitTimeoutMillis) throws InterruptedException {
        ServerConfig config = new ServerConfig();
        config.setPort(0);
        config.setBindAddress("127.0.0.1");
        config.setMaxClients(maxClients);
        config.setPermitTimeoutMillis(permitTimeoutMillis);
        config.setEvictionIntervalMillis(20);
        RespKvServer s = new RespKvServer(config);
        s.start();
        return s;
    }

    private Socket connect() throws IOException {
        return connect(server);
    }

    private static Socket connect(RespKvServer s) throws IOException {
        Socket socket = new Socket("127.0.0.1", s.getPort());
        socket.setSoTimeout(3000);
        return socket;
    }

    private static String args(String... words) {
        StringBuilder sb = new StringBuilder("*").append(words.length).append("\r\n");
        for (String w : words) {
            sb.append('$').append(w.getBytes(StandardCharsets.UTF_8).length).append("\r\n").append(w).append("\r\n");
        }
        return sb.toString();
    }

    private static void send(Socket socket, String request) throws IOException {
        OutputStream out = socket.getOutputStream();
        out.write(request.getBytes(StandardCharsets.UTF_8));
        out.flush();
    }

    // 读到恰好 expected 长度的回复
    private static String read(Socket socket, int length) throws IOException {
        InputStream in = socket.getInputStream();
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        while (buf.size() < length) {
            int b = in.read();
            if (b < 0) break;
            buf.write(b);
        }
        return buf.toString(StandardCharsets.UTF_8);
    }

    private static String call(Socket socket, String request, String expected) throws IOException {
        send(socket, request);
        return read(socket, expected.length());
    }

    private static void assertReply(Socket socket, String request, String expected) throws IOException {
        assertEquals(expected, call(socket, request, expected));
    }

    // 对端关闭时 read 返回 -1 (或者连接被重置)
    private static boolean isClosedByPeer(Socket socket) throws IOException {
        try {
            return socket.getInputStream().read() == -1;
        } catch (SocketTimeoutException e) {
            return false;
        } catch (IOException e) {
            return true;
        }
    }

    @Test
    void testPingEchoAndPing() throws IOException {
        try (Socket socket = connect()) {
            assertReply(socket, args("PING"), "+PONG\r\n");
            assertReply(socket, args("PING", "Hello, world!"), "$13\r\nHello, world!\r\n");
            assertReply(socket, args("ECHO", "Hey"), "$3\r\nHey\r\n");
        }
    }

    @Test
    void testSetGetAcrossConnections() throws IOException {
        try (Socket a = connect(); Socket b = connect()) {
            assertReply(a, args("GET", "key01"), "$-1\r\n");
            assertReply(a, args("SET", "key01", "hello"), "+OK\r\n");
            assertReply(b, args("GET", "key01"), "$5\r\nhello\r\n");
        }
    }

    @Test
    void testPxExpiry() throws Exception {
        try (Socket socket = connect()) {
            assertReply(socket, args("SET", "key02", "v", "PX", "100"), "+OK\r\n");
            Thread.sleep(20);
            assertReply(socket, args("GET", "key02"), "$1\r\nv\r\n");
            Thread.sleep(150);
            assertReply(socket, args("GET", "key02"), "$-1\r\n");
        }
    }

    @Test
    void testExExpiry() throws Exception {
        try (Socket socket = connect()) {
            assertReply(socket, args("SET", "key03", "v", "EX", "1"), "+OK\r\n");
            assertReply(socket, args("GET", "key03"), "$1\r\nv\r\n");
            Thread.sleep(1200);
            assertReply(socket, args("GET", "key03"), "$-1\r\n");
        }
    }

    @Test
    void testSetClearsTtl() throws Exception {
        try (Socket socket = connect()) {
            assertReply(socket, args("SET", "key07", "a", "PX", "100"), "+OK\r\n");
            assertReply(socket, args("SET", "key07", "b"), "+OK\r\n");
            Thread.sleep(200);
            assertReply(socket, args("GET", "key07"), "$1\r\nb\r\n");
        }
    }

    @Test
    void testPipelining() throws IOException {
        try (Socket socket = connect()) {
            assertReply(socket, args("PING", "PING", "PING"), "+PONG\r\n+PONG\r\n+PONG\r\n");
            assertReply(socket, args("SET", "p", "1", "GET", "p", "ECHO", "x"), "+OK\r\n$1\r\n1\r\n$1\r\nx\r\n");
        }
    }

    @Test
    void testMalformedRequestClosesConnection() throws IOException {
        try (Socket socket = connect()) {
            send(socket, "*1\r\n$4\r\nPINGX\r\n");
            assertTrue(isClosedByPeer(socket));
        }
        // 服务继续接受新连接
        try (Socket socket = connect()) {
            assertReply(socket, args("PING"), "+PONG\r\n");
        }
    }

    @Test
    void testConcurrentClients() throws Exception {
        int clients = 8;
        ExecutorService pool = Executors.newFixedThreadPool(clients);
        try {
            List<Future<Boolean>> results = new ArrayList<>();
            for (int i = 0; i < clients; i++) {
                String key = "client-" + i;
                Callable<Boolean> task = () -> {
                    try (Socket socket = connect()) {
                        for (int n = 0; n < 50; n++) {
                            String value = key + "-" + n;
                            if (!"+OK\r\n".equals(call(socket, args("SET", key, value), "+OK\r\n"))) {
                                return false;
                            }
                            String expected = "$" + value.length() + "\r\n" + value + "\r\n";
                            if (!expected.equals(call(socket, args("GET", key), expected))) {
                                return false;
                            }
                        }
                        return true;
                    }
                };
                results.add(pool.submit(task));
            }
            for (Future<Boolean> result : results) {
                assertTrue(result.get(10, TimeUnit.SECONDS));
            }
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void testConnectionOverLimitIsDropped() throws Exception {
        RespKvServer limited = startServer(1, 100);
        try (Socket first = connect(limited)) {
            assertReply(first, args("PING"), "+PONG\r\n");

            try (Socket second = connect(limited)) {
                // 名额等待超时后被直接断开，不会收到任何回复
                assertTrue(isClosedByPeer(second));
            }

            assertReply(first, args("PING"), "+PONG\r\n");
        } finally {
            limited.stop();
        }
    }

    @Test
    void testPermitReturnedAfterDisconnect() throws Exception {
        RespKvServer limited = startServer(1, 2000);
        try {
            try (Socket first = connect(limited)) {
                assertReply(first, args("PING"), "+PONG\r\n");
            }
            // 上一个连接关闭后名额归还，下一个连接在超时前拿到名额
            try (Socket second = connect(limited)) {
                assertReply(second, args("ECHO", "again"), "$5\r\nagain\r\n");
            }
        } finally {
            limited.stop();
        }
    }
}
