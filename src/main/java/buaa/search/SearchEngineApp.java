package buaa.search;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * 多模态网页搜索引擎启动类
 */
@SpringBootApplication
public class SearchEngineApp {

    public static void main(String[] args) {
        SpringApplication.run(SearchEngineApp.class, args);
    }
}
