package com.fincheck.meta;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;

/**
 * 配置表 YAML 解析器，路径以 classpath: 开头时从类路径读取
 */
public class Parser {
    public static final String CLASSPATH_PREFIX = "classpath:";

    private final String filePath;
    private final ObjectMapper yamlMapper;

    public Parser(String filePath) {
        this.filePath = filePath;
        this.yamlMapper = new ObjectMapper(new YAMLFactory());
        this.yamlMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public CheckConfig parse() throws IOException {
        if (filePath.startsWith(CLASSPATH_PREFIX)) {
            String resource = filePath.substring(CLASSPATH_PREFIX.length());
            if (resource.startsWith("/")) {
                resource = resource.substring(1);
            }
            try (InputStream in = Parser.class.getClassLoader().getResourceAsStream(resource)) {
                if (in == null) {
                    throw new IOException("config file not found on classpath: " + resource);
                }
                return yamlMapper.readValue(in, CheckConfig.class);
            }
        }

        File file = new File(filePath);
        if (!file.exists()) {
            throw new IOException("config file not found: " + filePath);
        }
        return yamlMapper.readValue(file, CheckConfig.class);
    }
}
