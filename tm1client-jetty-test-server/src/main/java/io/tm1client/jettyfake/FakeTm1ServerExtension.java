package io.tm1client.jettyfake;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.junit.jupiter.api.extension.BeforeAllCallback;
import org.junit.jupiter.api.extension.BeforeEachCallback;
import org.junit.jupiter.api.extension.ExtensionContext;

import java.io.IOException;

////*
///  A JUnit Jupiter extension that shares one [FakeTm1Server] across a test module.
///
///  The server is started lazily on first access and stopped by a JVM shutdown hook. Routes
///  and recorded requests are cleared before each test, so every test scripts the replies it
///  needs and sees only its own wire trace.
///
/// Example usage:
///
/// ```java
/// @ExtendWith(FakeTm1ServerExtension.class)
/// public class MyTest {
///     @Test
///     public void testSomething() {
///         FakeTm1Server server = FakeTm1ServerExtension.getServer();
///         server.on("GET", "/Cubes", FakeReply.json("{\"value\":[]}"));
///     }
/// }
/// ```
///
public class FakeTm1ServerExtension implements BeforeAllCallback, BeforeEachCallback {
    private static final Logger logger = LogManager.getLogger(FakeTm1ServerExtension.class);
    private static final Object lock = new Object();
    private static FakeTm1Server server;

    /**
     * Initializes and starts the server if not already started.
     * This method is thread-safe and idempotent.
     */
    public static void initialize() {
        synchronized (lock) {
            if (server == null) {
                try {
                    logger.info("Starting fake TM1 server for the module");
                    FakeTm1Server started = new FakeTm1Server();
                    started.start();
                    server = started;

                    Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                        if (server != null) {
                            logger.info("Stopping fake TM1 server (shutdown hook)");
                            server.close();
                            server = null;
                        }
                    }));
                } catch (IOException e) {
                    logger.error("Failed to start fake TM1 server", e);
                    throw new RuntimeException("Failed to start fake TM1 server", e);
                }
            }
        }
    }

    /**
     * Gets the shared fake server.
     * @return The FakeTm1Server instance
     */
    public static FakeTm1Server getServer() {
        initialize();
        return server;
    }

    @Override
    public void beforeAll(ExtensionContext context) {
        initialize();
        logger.debug("FakeTm1ServerExtension beforeAll called for {}", context.getDisplayName());
    }

    @Override
    public void beforeEach(ExtensionContext context) {
        getServer().reset();
    }
}
