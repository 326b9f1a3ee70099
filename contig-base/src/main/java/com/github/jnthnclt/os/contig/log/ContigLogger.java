package com.github.jnthnclt.os.contig.log;

public interface ContigLogger {

    boolean isDebugEnabled();

    void debug(String msg);

    void debug(String messagePattern, Object arg);

    void debug(String messagePattern, Object arg1, Object arg2);

    void debug(String messagePattern, Object... argArray);

    void debug(String msg, Throwable t);

    void info(String msg);

    void info(String messagePattern, Object arg);

    void info(String messagePattern, Object arg1, Object arg2);

    void info(String messagePattern, Object... argArray);

    void info(String msg, Throwable t);

    void warn(String msg);

    void warn(String messagePattern, Object arg);

    void warn(String messagePattern, Object arg1, Object arg2);

    void warn(String messagePattern, Object... argArray);

    void warn(String msg, Throwable t);

    void error(String msg);

    void error(String messagePattern, Object arg);

    void error(String messagePattern, Object arg1, Object arg2);

    void error(String messagePattern, Object... argArray);

    void error(String msg, Throwable t);
}
