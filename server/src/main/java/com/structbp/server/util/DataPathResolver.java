package com.structbp.server.util;

import com.structbp.server.config.InferenceConfig;

import java.io.File;

public class DataPathResolver {

    public static final String DATA_DIR_PROPERTY = "structuredbp.data.dir";

    public static String resolveDataDirectory(InferenceConfig config) {
        // 1. Check System Property
        String sysProp = System.getProperty(DATA_DIR_PROPERTY);
        if (sysProp != null && !sysProp.isEmpty()) {
            return sysProp;
        }

        // 2. Check Config
        if (config != null && config.data_directory != null && !config.data_directory.isEmpty()) {
            return config.data_directory;
        }

        // 3. Default
        return ".";
    }

    public static String resolveDbPath(InferenceConfig config) {
        String fileName = config != null ? config.getCacheDbFileName() : InferenceConfig.DEFAULT_DB_FILE;
        return resolveDataDirectory(config) + File.separator + fileName;
    }
}
