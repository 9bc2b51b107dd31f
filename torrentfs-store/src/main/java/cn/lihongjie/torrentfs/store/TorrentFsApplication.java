package cn.lihongjie.torrentfs.store;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * 种子存储服务主类
 * 启动后检查种子目录并输出状态，不启用Web服务器
 */
@Slf4j
@SpringBootApplication(scanBasePackages = "cn.lihongjie.torrentfs")
public class TorrentFsApplication {

    public static void main(String[] args) {
        log.info("========================================");
        log.info("Torrent Store Starting...");
        log.info("========================================");

        SpringApplication.run(TorrentFsApplication.class, args);
    }
}
