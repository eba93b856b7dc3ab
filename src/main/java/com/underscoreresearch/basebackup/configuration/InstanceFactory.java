package com.underscoreresearch.basebackup.configuration;

import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import com.google.inject.Guice;
import com.google.inject.Injector;

public final class InstanceFactory {
    private static final ReentrantReadWriteLock configReadWriteLock = new ReentrantReadWriteLock();
    private static final Lock configUseLock = configReadWriteLock.readLock();
    private static final Lock configChangeLock = configReadWriteLock.writeLock();
    private static Injector injector;

    private InstanceFactory() {
    }

    public static void initialize(String[] argv) {
        configChangeLock.lock();
        try {
            injector = Guice.createInjector(
                    new CommandLineModule(argv),
                    new BackupModule());
        } finally {
            configChangeLock.unlock();
        }
    }

    public static void reset() {
        configChangeLock.lock();
        try {
            injector = null;
        } finally {
            configChangeLock.unlock();
        }
    }

    public static boolean isInitialized() {
        configUseLock.lock();
        try {
            return injector != null;
        } finally {
            configUseLock.unlock();
        }
    }

    public static <T> T getInstance(Class<T> tClass) {
        configUseLock.lock();
        try {
            return injector.getInstance(tClass);
        } finally {
            configUseLock.unlock();
        }
    }
}
