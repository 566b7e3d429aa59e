package com.linlay.agentengine.memory;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "memory.structured")
public class StructuredMemoryProperties {

    private String rootDir = "./data/memory";
    private int extractionWindow = 10;
    private String charset = "UTF-8";

    public String getRootDir() {
        return rootDir;
    }

    public void setRootDir(String rootDir) {
        this.rootDir = rootDir;
    }

    public int getExtractionWindow() {
        return extractionWindow;
    }

    public void setExtractionWindow(int extractionWindow) {
        this.extractionWindow = extractionWindow;
    }

    public String getCharset() {
        return charset;
    }

    public void setCharset(String charset) {
        this.charset = charset;
    }
}
