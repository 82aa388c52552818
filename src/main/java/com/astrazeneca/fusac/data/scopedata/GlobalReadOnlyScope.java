package com.astrazeneca.fusac.data.scopedata;

import com.astrazeneca.fusac.Configuration;

/**
 * Global scope of FUSAC. Contains configuration that must be available from all the classes and methods.
 * Must be initialized only once. Clear method created only for testing purposes.
 */
public class GlobalReadOnlyScope {

    private volatile static GlobalReadOnlyScope instance;

    public static GlobalReadOnlyScope instance() {
        return instance;
    }

    public static synchronized void init(Configuration conf) {
        if (instance != null) {
            throw new IllegalStateException("GlobalReadOnlyScope was already initialized. Must be initialized only once.");
        }
        instance = new GlobalReadOnlyScope(conf);
    }

    /**
     * TEST usage only
     */
    public static synchronized void clear(){
        instance = null;
    }

    public final Configuration conf;

    public GlobalReadOnlyScope(Configuration conf) {
        this.conf = conf;
    }
}
