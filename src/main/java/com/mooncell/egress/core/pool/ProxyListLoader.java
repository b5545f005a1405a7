package com.mooncell.egress.core.pool;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 从文本文件读取出口地址：每行一个，忽略空行和 # 注释行；文件不存在时返回空列表
 */
@Slf4j
public final class ProxyListLoader {

    private ProxyListLoader() {
    }

    public static List<String> load(Path path) {
        if (path == null || !Files.exists(path)) {
            log.warn("Proxy list file {} not found, starting with an empty pool", path);
            return List.of();
        }
        try {
            return Files.readAllLines(path, StandardCharsets.UTF_8).stream()
                    .map(String::trim)
                    .filter(line -> !line.isEmpty() && !line.startsWith("#"))
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read proxy list " + path, e);
        }
    }
}
