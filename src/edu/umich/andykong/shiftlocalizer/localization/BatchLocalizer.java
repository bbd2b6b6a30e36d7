/*
 *    Copyright 2022 University of Michigan
 *
 *    Licensed under the Apache License, Version 2.0 (the "License");
 *    you may not use this file except in compliance with the License.
 *    You may obtain a copy of the License at
 *
 *        http://www.apache.org/licenses/LICENSE-2.0
 *
 *    Unless required by applicable law or agreed to in writing, software
 *    distributed under the License is distributed on an "AS IS" BASIS,
 *    WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *    See the License for the specific language governing permissions and
 *    limitations under the License.
 */

package edu.umich.andykong.shiftlocalizer.localization;

import edu.umich.andykong.shiftlocalizer.core.LocalizationException;
import edu.umich.andykong.shiftlocalizer.core.PsmRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Localizes a list of PSMs on a worker pool. PSMs are independent, so blocks of them run in any order
 * and results are stored by input index.
 */
public class BatchLocalizer {
    private static final Logger log = LoggerFactory.getLogger(BatchLocalizer.class);

    static final int BLOCKSIZE = 100; //number of PSMs per task, cuts down on task overhead
    static final int PROGRESS_INTERVAL = 10000;

    private final ShiftLocalization localizer;
    private final ExecutorService executorService;
    private final boolean failFast;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public BatchLocalizer(ShiftLocalization localizer, ExecutorService executorService, boolean failFast) {
        this.localizer = localizer;
        this.executorService = executorService;
        this.failFast = failFast;
    }

    /**
     * Stop handing out PSMs of the running batch. PSMs already finished keep their results, the rest are
     * reported as skipped. The next call to localizeAll starts uncancelled.
     */
    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Localize all PSMs, one batch at a time per instance.
     */
    public BatchResult localizeAll(List<PsmRecord> psms) throws InterruptedException, ExecutionException {
        cancelled.set(false);
        LocalizationResult[] results = new LocalizationResult[psms.size()];
        LocalizationFailure[] failures = new LocalizationFailure[psms.size()];
        AtomicInteger done = new AtomicInteger(0);

        int nBlocks = psms.size() / BLOCKSIZE;
        if (psms.size() % BLOCKSIZE != 0)
            nBlocks++;
        ArrayList<Future<?>> futureList = new ArrayList<>(nBlocks);
        for (int i = 0; i < nBlocks; i++) {
            int startInd = i * BLOCKSIZE;
            int endInd = Math.min((i + 1) * BLOCKSIZE, psms.size());
            futureList.add(executorService.submit(() -> processBlock(psms, startInd, endInd, results, failures, done)));
        }
        for (Future<?> future : futureList)
            future.get();

        BatchResult br = new BatchResult(results, failures, cancelled.get());
        if (br.isCancelled())
            log.warn("Localization cancelled, {} of {} PSMs were not processed", br.getSkipped(), psms.size());
        return br;
    }

    private void processBlock(List<PsmRecord> psms, int startInd, int endInd, LocalizationResult[] results,
                              LocalizationFailure[] failures, AtomicInteger done) {
        for (int i = startInd; i < endInd; i++) {
            if (cancelled.get())
                return;
            PsmRecord psm = psms.get(i);
            try {
                results[i] = localizer.localize(psm);
            } catch (LocalizationException e) {
                failures[i] = new LocalizationFailure(psm, e);
                log.debug("Could not localize {}: {}", psm.getRecordId(), e.getMessage());
                if (failFast && cancelled.compareAndSet(false, true))
                    log.error("Stopping at first failed PSM: {}", e.getMessage());
            }
            int n = done.incrementAndGet();
            if (n % PROGRESS_INTERVAL == 0)
                log.info(" {}%", (int) (100.0 * n / psms.size()));
        }
    }
}
