// Copyright (c) 2013, Johns Hopkins University. All rights reserved.
// This software is released under the 2-clause BSD license.
// See /LICENSE.txt

package edu.jhu.hlt.labelfsa.inference.acceptors;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.logging.Logger;

import com.google.common.base.Preconditions;
import com.google.common.base.Throwables;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;

import edu.jhu.hlt.labelfsa.util.LabelFsaConfig;

/**
 * Builds one acceptor per label sequence of a batch, in parallel. The
 * builders share nothing, so each sequence is simply its own task.
 */
public class BatchAcceptorBuilder {

    private static final Logger logger = Logger.getLogger(BatchAcceptorBuilder.class.getName());

    private final AcceptorBuilder builder;
    private final int threads;

    public BatchAcceptorBuilder(AcceptorBuilder builder, int threads) {
        Preconditions.checkNotNull(builder, "builder");
        Preconditions.checkArgument(threads >= 1, "need at least one thread, got %s", threads);
        this.builder = builder;
        this.threads = threads;
    }

    /** Thread count from {@link LabelFsaConfig#BATCH_THREADS}, defaulting to the processor count. */
    public BatchAcceptorBuilder(AcceptorBuilder builder) {
        this(builder, LabelFsaConfig.getInt(LabelFsaConfig.BATCH_THREADS,
                                            Runtime.getRuntime().availableProcessors()));
    }

    public int getThreads() { return threads; }

    /**
     * @return the automata in the order of {@code labelSeqs}
     * @throws InvalidLabelSequenceException if any sequence is invalid
     */
    public List<Automaton> buildAll(final int numLabels, List<int []> labelSeqs) throws InterruptedException {
        ListeningExecutorService pool = MoreExecutors.listeningDecorator(Executors.newFixedThreadPool(threads));
        try {
            List<ListenableFuture<Automaton>> futures = new ArrayList<ListenableFuture<Automaton>>(labelSeqs.size());
            for (final int [] labelSeq : labelSeqs) {
                futures.add(pool.submit(new Callable<Automaton>() {
                    @Override
                    public Automaton call() {
                        return builder.build(numLabels, labelSeq);
                    }
                }));
            }
            List<Automaton> built = Futures.allAsList(futures).get();
            logger.fine("Built " + built.size() + " acceptors on " + threads + " thread(s)");
            return built;
        } catch (ExecutionException e) {
            Throwables.throwIfUnchecked(e.getCause());
            throw new RuntimeException(e.getCause());
        } finally {
            pool.shutdownNow();
        }
    }
}
