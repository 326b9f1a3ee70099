package com.github.jnthnclt.os.contig.log;

import java.io.PrintStream;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

public class ContigLoggerFactory {

    public interface ContigLoggerProvider {
        ContigLogger createLogger(String name);
    }

    public static final ConcurrentHashMap<String, ContigLogger> loggers = new ConcurrentHashMap<>();
    public static final AtomicReference<ContigLoggerProvider> CONTIG_LOGGER_PROVIDER = new AtomicReference<>(
        name -> new SysoutContigLogger(name, SysoutContigLoggerLevel.INFO));

    public static ContigLogger getLogger() {
        StackTraceElement[] elements = Thread.currentThread().getStackTrace();
        String name = elements[2].getClassName();
        return loggers.computeIfAbsent(name, s -> CONTIG_LOGGER_PROVIDER.get().createLogger(name));
    }

    public static ContigLogger getLogger(Class<?> clazz) {
        String name = clazz.getName();
        return loggers.computeIfAbsent(name, s -> CONTIG_LOGGER_PROVIDER.get().createLogger(name));
    }

    public enum SysoutContigLoggerLevel {
        ERROR, WARN, INFO, DEBUG
    }

    public static class SysoutContigLogger implements ContigLogger {

        private final String name;
        private final SysoutContigLoggerLevel level;
        private final PrintStream out;

        public SysoutContigLogger(String name, SysoutContigLoggerLevel level) {
            this(name, level, System.out);
        }

        public SysoutContigLogger(String name, SysoutContigLoggerLevel level, PrintStream out) {
            this.name = name;
            this.level = level;
            this.out = out;
        }

        private boolean enabled(SysoutContigLoggerLevel at) {
            return level.ordinal() >= at.ordinal();
        }

        private void log(SysoutContigLoggerLevel at, String msg, Throwable t) {
            if (enabled(at)) {
                out.println(at.name() + ": " + Thread.currentThread().getName() + " " + name + " " + msg);
                if (t != null) {
                    t.printStackTrace(out);
                }
            }
        }

        @Override
        public boolean isDebugEnabled() {
            return enabled(SysoutContigLoggerLevel.DEBUG);
        }

        @Override
        public void debug(String msg) {
            log(SysoutContigLoggerLevel.DEBUG, msg, null);
        }

        @Override
        public void debug(String messagePattern, Object arg) {
            log(SysoutContigLoggerLevel.DEBUG, MessageFormatter.format(messagePattern, arg), null);
        }

        @Override
        public void debug(String messagePattern, Object arg1, Object arg2) {
            log(SysoutContigLoggerLevel.DEBUG, MessageFormatter.format(messagePattern, arg1, arg2), null);
        }

        @Override
        public void debug(String messagePattern, Object... argArray) {
            log(SysoutContigLoggerLevel.DEBUG, MessageFormatter.format(messagePattern, argArray), null);
        }

        @Override
        public void debug(String msg, Throwable t) {
            log(SysoutContigLoggerLevel.DEBUG, msg, t);
        }

        @Override
        public void info(String msg) {
            log(SysoutContigLoggerLevel.INFO, msg, null);
        }

        @Override
        public void info(String messagePattern, Object arg) {
            log(SysoutContigLoggerLevel.INFO, MessageFormatter.format(messagePattern, arg), null);
        }

        @Override
        public void info(String messagePattern, Object arg1, Object arg2) {
            log(SysoutContigLoggerLevel.INFO, MessageFormatter.format(messagePattern, arg1, arg2), null);
        }

        @Override
        public void info(String messagePattern, Object... argArray) {
            log(SysoutContigLoggerLevel.INFO, MessageFormatter.format(messagePattern, argArray), null);
        }

        @Override
        public void info(String msg, Throwable t) {
            log(SysoutContigLoggerLevel.INFO, msg, t);
        }

        @Override
        public void warn(String msg) {
            log(SysoutContigLoggerLevel.WARN, msg, null);
        }

        @Override
        public void warn(String messagePattern, Object arg) {
            log(SysoutContigLoggerLevel.WARN, MessageFormatter.format(messagePattern, arg), null);
        }

        @Override
        public void warn(String messagePattern, Object arg1, Object arg2) {
            log(SysoutContigLoggerLevel.WARN, MessageFormatter.format(messagePattern, arg1, arg2), null);
        }

        @Override
        public void warn(String messagePattern, Object... argArray) {
            log(SysoutContigLoggerLevel.WARN, MessageFormatter.format(messagePattern, argArray), null);
        }

        @Override
        public void warn(String msg, Throwable t) {
            log(SysoutContigLoggerLevel.WARN, msg, t);
        }

        @Override
        public void error(String msg) {
            log(SysoutContigLoggerLevel.ERROR, msg, null);
        }

        @Override
        public void error(String messagePattern, Object arg) {
            log(SysoutContigLoggerLevel.ERROR, MessageFormatter.format(messagePattern, arg), null);
        }

        @Override
        public void error(String messagePattern, Object arg1, Object arg2) {
            log(SysoutContigLoggerLevel.ERROR, MessageFormatter.format(messagePattern, arg1, arg2), null);
        }

        @Override
        public void error(String messagePattern, Object... argArray) {
            log(SysoutContigLoggerLevel.ERROR, MessageFormatter.format(messagePattern, argArray), null);
        }

        @Override
        public void error(String msg, Throwable t) {
            log(SysoutContigLoggerLevel.ERROR, msg, t);
        }
    }
}
