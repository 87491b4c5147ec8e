package com.pharmasop;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * SOP 生成作业流水线应用启动类。
 * <p>
 * 位于顶层包路径，确保能够扫描到各子模块中的组件与 MyBatis Mapper。
 * </p>
 *
 * @author pharmasop
 * @since 2026-10-01
 */
@SpringBootApplication
public class Application {

    public static void main(String[] args) {
        SpringApplication.run(Application.class, args);
    }

}
