package com.community.moderation.service;

import com.community.moderation.config.ModerationProperties;
import com.community.moderation.dto.RuleRequest;
import com.community.moderation.entity.ModerationRule;
import com.community.moderation.exception.ConflictException;
import com.community.moderation.exception.NotFoundException;
import com.community.moderation.exception.ValidationException;
import com.community.moderation.model.SeverityRating;
import com.community.moderation.repository.ModerationRuleRepository;
import com.community.moderation.rule.RuleEngine;
import com.community.moderation.util.AfterCommit;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

@Service
public class RuleServiceImpl implements RuleService {

    private static final Logger log = LoggerFactory.getLogger(RuleServiceImpl.class);

    private final ModerationRuleRepository ruleRepository;
    private final RuleEngine ruleEngine;
    private final ModerationProperties properties;
    private final ObjectMapper objectMapper;
    private final ResourceLoader resourceLoader;
    private final Clock clock;

    public RuleServiceImpl(ModerationRuleRepository ruleRepository,
                           RuleEngine ruleEngine,
                           ModerationProperties properties,
                           ObjectMapper objectMapper,
                           ResourceLoader resourceLoader,
                           Clock clock) {
        this.ruleRepository = ruleRepository;
        this.ruleEngine = ruleEngine;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.resourceLoader = resourceLoader;
        this.clock = clock;
    }

    @Override
    public List<ModerationRule> listRules() {
        return ruleRepository.findAllByOrderByPriorityDescRuleIdAsc();
    }

    @Override
    public ModerationRule getRule(String ruleId) {
        return ruleRepository.findById(ruleId)
                .orElseThrow(() -> new NotFoundException("Rule not found: " + ruleId));
    }

    @Override
    @Transactional
    public ModerationRule createRule(RuleRequest request) {
        String ruleId = request.getRuleId() == null || request.getRuleId().isBlank()
                ? "rule_" + UUID.randomUUID().toString().substring(0, 8)
                : request.getRuleId().trim();
        if (ruleRepository.existsById(ruleId)) {
            throw new ConflictException("Rule already exists: " + ruleId);
        }
        LocalDateTime now = LocalDateTime.now(clock);
        ModerationRule rule = new ModerationRule();
        rule.setRuleId(ruleId);
        rule.setCreatedAt(now);
        applyRequest(rule, request, now);

        ModerationRule saved = ruleRepository.save(rule);
        log.info("新建规则 {} ({})", saved.getRuleId(), saved.getName());
        AfterCommit.run(this::reload);
        return saved;
    }

    @Override
    @Transactional
    public ModerationRule updateRule(String ruleId, RuleRequest request) {
        ModerationRule rule = getRule(ruleId);
        applyRequest(rule, request, LocalDateTime.now(clock));
        ModerationRule saved = ruleRepository.save(rule);
        log.info("更新规则 {}", ruleId);
        AfterCommit.run(this::reload);
        return saved;
    }

    @Override
    @Transactional
    public ModerationRule setActive(String ruleId, boolean active) {
        ModerationRule rule = getRule(ruleId);
        rule.setActive(active);
        rule.setUpdatedAt(LocalDateTime.now(clock));
        ModerationRule saved = ruleRepository.save(rule);
        log.info("规则 {} 已{}", ruleId, active ? "启用" : "停用");
        AfterCommit.run(this::reload);
        return saved;
    }

    /**
     * 定期刷新：先把命中计数写回存储，再重新加载规则集
     */
    @Scheduled(fixedDelayString = "${moderation.rules.refresh-interval-ms:300000}",
               initialDelayString = "${moderation.rules.refresh-interval-ms:300000}")
    @Transactional
    public void refresh() {
        flushTriggerCounts();
        AfterCommit.run(this::reload);
    }

    @Override
    public int reload() {
        return ruleEngine.load(ruleRepository.findAllByOrderByPriorityDescRuleIdAsc());
    }

    @Override
    @Transactional
    public int seedIfEmpty() {
        if (ruleRepository.count() > 0) {
            return 0;
        }
        String location = properties.getRules().getSeedLocation();
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            log.warn("种子规则文件不存在: {}", location);
            return 0;
        }

        List<RuleRequest> seeds;
        try (InputStream in = resource.getInputStream()) {
            seeds = objectMapper.readValue(in, new TypeReference<List<RuleRequest>>() { });
        } catch (IOException e) {
            throw new IllegalStateException("无法读取种子规则: " + location, e);
        }

        LocalDateTime now = LocalDateTime.now(clock);
        List<ModerationRule> rules = new ArrayList<>();
        for (RuleRequest seed : seeds) {
            ModerationRule rule = new ModerationRule();
            rule.setRuleId(seed.getRuleId());
            rule.setCreatedAt(now);
            try {
                applyRequest(rule, seed, now);
                rules.add(rule);
            } catch (ValidationException e) {
                log.warn("种子规则 {} 无效，已跳过: {}", seed.getRuleId(), e.getMessage());
            }
        }
        ruleRepository.saveAll(rules);
        log.info("已导入 {} 条种子规则。", rules.size());
        return rules.size();
    }

    @Override
    @Transactional
    public Optional<Double> adjustThreshold(String ruleId, SeverityRating direction) {
        if (direction == SeverityRating.ACCURATE) {
            return Optional.empty();
        }
        Optional<ModerationRule> found = ruleRepository.findById(ruleId);
        if (found.isEmpty()) {
            log.warn("阈值调整跳过：规则 {} 不存在", ruleId);
            return Optional.empty();
        }
        ModerationRule rule = found.get();
        ModerationProperties.Rules config = properties.getRules();
        double current = rule.getActivationThreshold() != null
                ? rule.getActivationThreshold()
                : config.getDefaultActivationThreshold();
        double step = direction == SeverityRating.TOO_STRICT ? config.getThresholdStep() : -config.getThresholdStep();
        double next = BigDecimal.valueOf(current + step).setScale(4, RoundingMode.HALF_UP).doubleValue();
        next = Math.max(config.getMinActivationThreshold(), Math.min(config.getMaxActivationThreshold(), next));
        if (Math.abs(next - current) < 1e-9) {
            log.info("规则 {} 阈值已到边界 {}，不再调整", ruleId, current);
            return Optional.empty();
        }

        rule.setActivationThreshold(next);
        rule.setUpdatedAt(LocalDateTime.now(clock));
        ruleRepository.save(rule);
        log.info("规则 {} 激活阈值按社区反馈 ({}) 调整: {} -> {}", ruleId, direction.getCode(), current, next);
        AfterCommit.run(this::reload);
        return Optional.of(next);
    }

    private void flushTriggerCounts() {
        Map<String, Long> counts = ruleEngine.drainTriggerCounts();
        LocalDateTime now = LocalDateTime.now(clock);
        for (Map.Entry<String, Long> entry : counts.entrySet()) {
            ruleRepository.incrementTriggerCount(entry.getKey(), entry.getValue(), now);
        }
        if (!counts.isEmpty()) {
            log.debug("规则命中计数已写回: {}", counts);
        }
    }

    private void applyRequest(ModerationRule rule, RuleRequest request, LocalDateTime now) {
        rule.setName(request.getName());
        rule.setDescription(request.getDescription());
        rule.setPriority(request.getPriority());
        rule.setConditions(request.getConditions());
        rule.setActions(request.getActions());
        rule.setActive(request.getActive() == null || request.getActive());
        if (request.getActivationThreshold() != null
                && (request.getActivationThreshold() <= 0.0 || request.getActivationThreshold() > 1.0)) {
            throw new ValidationException("activationThreshold must be in (0, 1]");
        }
        rule.setActivationThreshold(request.getActivationThreshold());
        rule.setUpdatedAt(now);

        String problem = ruleEngine.validate(rule);
        if (problem != null) {
            throw new ValidationException("Invalid rule: " + problem);
        }
    }
}
