package me.golemcore.timeseries.lifecycle;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ApplicationContext;
import org.springframework.stereotype.Service;

/**
 * Terminates the process after closing the application context.
 *
 * <p>
 * Runs on its own non-daemon thread so it can be invoked from any thread,
 * including ones the context shutdown waits for.
 *
 * @since 1.0
 */
@Service
@Slf4j
public class ProcessExitService {

    private final ApplicationContext applicationContext;

    public ProcessExitService(ApplicationContext applicationContext) {
        this.applicationContext = applicationContext;
    }

    @SuppressWarnings({ "PMD.DoNotTerminateVM", "java:S1147" })
    public void exit(int statusCode) {
        Thread exitThread = new Thread(() -> {
            log.info("[Lifecycle] Exiting with status {}", statusCode);
            int exitCode = SpringApplication.exit(applicationContext, () -> statusCode);
            System.exit(exitCode); // NOSONAR
        }, "process-exit-thread");
        exitThread.setDaemon(false);
        exitThread.start();
    }
}
