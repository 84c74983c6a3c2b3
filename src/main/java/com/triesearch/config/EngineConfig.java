package com.triesearch.config;

/**
 * 引擎运行时配置
 * 
 * 支持从CLI参数注入，覆盖Constants默认值
 */
public class EngineConfig {
    private boolean caseSensitive = true;
    private int completionLimit = Constants.DEFAULT_COMPLETION_LIMIT;
    private int submatchLimit = Constants.DEFAULT_SUBMATCH_LIMIT;
    private int maxCost = Constants.DEFAULT_MAX_COST;
    private int submatchMinQueryLength = Constants.DEFAULT_SUBMATCH_MIN_QUERY_LENGTH;
    
    public boolean isCaseSensitive() {
        return caseSensitive;
    }
    
    public void setCaseSensitive(boolean caseSensitive) {
        this.caseSensitive = caseSensitive;
    }
    
    public int getCompletionLimit() {
        return completionLimit;
    }
    
    public void setCompletionLimit(int completionLimit) {
        this.completionLimit = completionLimit;
    }
    
    public int getSubmatchLimit() {
        return submatchLimit;
    }
    
    public void setSubmatchLimit(int submatchLimit) {
        this.submatchLimit = submatchLimit;
    }
    
    public int getMaxCost() {
        return maxCost;
    }
    
    public void setMaxCost(int maxCost) {
        this.maxCost = maxCost;
    }
    
    public int getSubmatchMinQueryLength() {
        return submatchMinQueryLength;
    }
    
    public void setSubmatchMinQueryLength(int submatchMinQueryLength) {
        this.submatchMinQueryLength = submatchMinQueryLength;
    }
    
    /**
     * 使用默认配置创建实例
     */
    public static EngineConfig defaults() {
        return new EngineConfig();
    }
}
