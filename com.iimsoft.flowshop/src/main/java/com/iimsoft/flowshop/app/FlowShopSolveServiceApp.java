package com.iimsoft.flowshop.app;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.iimsoft.flowshop.api.dto.SolveRequest;
import com.iimsoft.flowshop.api.dto.SolveResponse;
import com.iimsoft.flowshop.exception.FlowShopException;
import com.iimsoft.flowshop.service.FlowShopSolveService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 统一入口：从 JSON 请求调用 FlowShopSolveService，结果以 JSON 打印到 stdout。
 *
 * 用法：
 * - 读取文件：mvn exec:java -Dexec.args=path/to/request.json
 * - 读取 stdin：mvn exec:java -Dexec.args=- < request.json
 * - 不带参数：使用 classpath 上的 example_request.json
 */
public class FlowShopSolveServiceApp {

    private static final Logger LOGGER = LoggerFactory.getLogger(FlowShopSolveServiceApp.class);

    static final String EXAMPLE_REQUEST = "example_request.json";

    public static void main(String[] args) throws Exception {
        ObjectMapper mapper = new ObjectMapper();

        SolveRequest request;
        try {
            request = readRequest(mapper, args);
        } catch (IOException e) {
            LOGGER.error("Failed to read request", e);
            System.exit(2);
            return;
        }
        if (request == null) {
            System.exit(2);
            return;
        }

        SolveResponse response;
        try {
            response = new FlowShopSolveService().solve(request);
        } catch (FlowShopException | IllegalArgumentException e) {
            LOGGER.error("Invalid request: {}", e.getMessage());
            System.exit(2);
            return;
        }
        String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(response);
        System.out.println(json);
    }

    static SolveRequest readRequest(ObjectMapper mapper, String[] args) throws IOException {
        if (args == null || args.length == 0 || args[0] == null || args[0].isBlank()) {
            LOGGER.info("No input file specified. Using {} from the classpath.", EXAMPLE_REQUEST);
            try (InputStream in = FlowShopSolveServiceApp.class.getClassLoader().getResourceAsStream(EXAMPLE_REQUEST)) {
                if (in == null) {
                    LOGGER.error("Example request {} not found on the classpath", EXAMPLE_REQUEST);
                    return null;
                }
                return mapper.readValue(in, SolveRequest.class);
            }
        }

        String input = args[0].trim();
        if ("-".equals(input)) {
            try (InputStream in = System.in) {
                return mapper.readValue(in, SolveRequest.class);
            }
        }
        Path path = Path.of(input);
        if (!Files.exists(path) || Files.isDirectory(path)) {
            LOGGER.error("Request file does not exist or is a directory: {}", path.toAbsolutePath());
            return null;
        }
        return mapper.readValue(new File(path.toString()), SolveRequest.class);
    }
}
