package com.pipeline.climate.model;

import java.io.Serializable;
import java.util.List;
import java.util.Optional;

/**
 * 算子元数据，描述算子的注册名、版本、参数定义和用途。
 * 参数定义中的默认值只用于展示和校验，实际默认值由算子的 configure 决定。
 */
public class FunctionMetadata implements Serializable {
    private String functionId;
    private String name;
    private String version;
    private String description;
    /** 算子参数定义列表 */
    private List<ParameterDefinition> parameterDefinitions;

    public FunctionMetadata() {}

    public FunctionMetadata(String functionId, String name, String description,
                            List<ParameterDefinition> parameterDefinitions) {
        this.functionId = functionId;
        this.name = name;
        this.version = "1.0.0";
        this.description = description;
        this.parameterDefinitions = parameterDefinitions;
    }

    public String getFunctionId() { return functionId; }
    public void setFunctionId(String functionId) { this.functionId = functionId; }
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public String getVersion() { return version; }
    public void setVersion(String version) { this.version = version; }
    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }
    /**
     * 按路径查找参数定义，嵌套参数用 "." 分隔，例如 "kwargs_std.ddof"。
     */
    public Optional<ParameterDefinition> findParameter(String path) {
        List<ParameterDefinition> level = parameterDefinitions;
        ParameterDefinition found = null;
        for (String part : path.split("\\.")) {
            if (level == null) {
                return Optional.empty();
            }
            found = level.stream().filter(d -> part.equals(d.getName())).findFirst().orElse(null);
            if (found == null) {
                return Optional.empty();
            }
            level = found.getChildren();
        }
        return Optional.ofNullable(found);
    }

    public List<ParameterDefinition> getParameterDefinitions() { return parameterDefinitions; }
    public void setParameterDefinitions(List<ParameterDefinition> parameterDefinitions) { this.parameterDefinitions = parameterDefinitions; }
}
