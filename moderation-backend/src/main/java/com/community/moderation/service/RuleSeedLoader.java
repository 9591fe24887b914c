package com.community.moderation.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * 启动时导入种子规则并加载规则集
 */
@Component
public class RuleSeedLoader implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(RuleSeedLoader.class);

    private final RuleService ruleService;

    public RuleSeedLoader(RuleService ruleService) {
        this.ruleService = ruleService;
    }

    @Override
    public void run(ApplicationArguments args) {
        int seeded = ruleService.seedIfEmpty();
        int loaded = ruleService.reload();
        log.info("规则初始化完成：导入 {} 条，生效 {} 条。", seeded, loaded);
    }
}
