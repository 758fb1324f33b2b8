/*
 * Copyright (c) 2025 Hal Hildebrand. All rights reserved.
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.viewport.queue;

import java.util.Objects;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Capacity-one, overwrite-on-write mailbox holding the latest camera pose and its generation.
 * <p>
 * Every accepted update increments the generation by exactly one and replaces the stored pose; older poses are
 * simply forgotten. Writers never wait on readers. The render worker parks in {@link #awaitNewer(long)} when it has
 * nothing left to do for the current generation.
 *
 * @author hal.hildebrand
 */
public class PoseStore {

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition updated = lock.newCondition();
    private final boolean suppressDuplicates;

    private PoseSnapshot latest = PoseSnapshot.INITIAL;

    public PoseStore() {
        this(false);
    }

    /**
     * @param suppressDuplicates when true, an update equal to the stored pose is not accepted
     */
    public PoseStore(boolean suppressDuplicates) {
        this.suppressDuplicates = suppressDuplicates;
    }

    /**
     * Replace the stored pose.
     *
     * @return the generation now current; the new one, or the unchanged one if the update was a suppressed duplicate
     */
    public long update(CameraPose pose) {
        Objects.requireNonNull(pose, "pose");
        lock.lock();
        try {
            if (suppressDuplicates && pose.equals(latest.pose())) {
                return latest.generation();
            }
            latest = new PoseSnapshot(latest.generation() + 1, pose);
            updated.signalAll();
            return latest.generation();
        } finally {
            lock.unlock();
        }
    }

    public PoseSnapshot snapshot() {
        lock.lock();
        try {
            return latest;
        } finally {
            lock.unlock();
        }
    }

    public long generation() {
        return snapshot().generation();
    }

    /**
     * Block until the stored generation exceeds {@code generation}.
     *
     * @return the latest snapshot, whose generation is greater than the argument
     * @throws InterruptedException if the waiting thread is interrupted
     */
    public PoseSnapshot awaitNewer(long generation) throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (latest.generation() <= generation) {
                updated.await();
            }
            return latest;
        } finally {
            lock.unlock();
        }
    }
}
