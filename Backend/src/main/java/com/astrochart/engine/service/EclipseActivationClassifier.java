package com.astrochart.engine.service;

import com.astrochart.engine.exception.InvalidChartException;
import com.astrochart.engine.model.ActivationStats;
import com.astrochart.engine.model.ActivationStatus;
import com.astrochart.engine.model.ChartSnapshot;
import com.astrochart.engine.model.EclipseActivation;
import com.astrochart.engine.model.EclipseActivationReport;
import com.astrochart.engine.model.EclipseEvent;
import com.astrochart.engine.model.EclipseType;
import com.astrochart.engine.model.SarosGroup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * 출생 차트에 영향을 주는 일식/월식의 활성 상태 분류 및 사로스 주기 그룹핑
 */
@Service
public class EclipseActivationClassifier {

    private static final Logger logger = LoggerFactory.getLogger(EclipseActivationClassifier.class);

    /** 사로스 주기 (약 18년 11일 8시간) */
    public static final double SAROS_PERIOD_DAYS = 6585.32;

    public static final double SAROS_TOLERANCE_DAYS = 5;

    private static final double DAYS_PER_MONTH = 30;

    private static final double MILLIS_PER_DAY = 24 * 60 * 60 * 1000.0;

    private static final Comparator<EclipseActivation> BY_DATE =
            Comparator.comparing(activation -> activation.getEclipse().getDate());

    private final EclipseImpactAnalyzer impactAnalyzer;

    public EclipseActivationClassifier(EclipseImpactAnalyzer impactAnalyzer) {
        this.impactAnalyzer = impactAnalyzer;
    }

    public List<EclipseActivation> classifyActivations(ChartSnapshot natalChart,
                                                       List<EclipseEvent> eclipseCatalog,
                                                       Instant referenceDate,
                                                       double orb) {
        return classifyActivations(natalChart, eclipseCatalog, referenceDate, orb, null);
    }

    /**
     * 영향이 있는 일식/월식만 골라 기준일 대비 상태를 붙인다. 카탈로그 순서를 유지한다.
     *
     * @param statusFilter 지정하면 해당 상태만 반환
     */
    public List<EclipseActivation> classifyActivations(ChartSnapshot natalChart,
                                                       List<EclipseEvent> eclipseCatalog,
                                                       Instant referenceDate,
                                                       double orb,
                                                       ActivationStatus statusFilter) {
        if (natalChart == null || natalChart.getPlanets() == null || natalChart.getPlanets().isEmpty()) {
            throw new InvalidChartException("천체 정보가 있는 출생 차트가 필요합니다");
        }
        if (referenceDate == null) {
            throw new IllegalArgumentException("기준일이 필요합니다");
        }
        if (eclipseCatalog == null || eclipseCatalog.isEmpty()) {
            return List.of();
        }

        List<EclipseActivation> activations = new ArrayList<>();

        for (EclipseEvent eclipse : eclipseCatalog) {
            if (eclipse == null || eclipse.getDate() == null) {
                logger.warn("날짜 없는 일식/월식 제외: {}", eclipse);
                continue;
            }

            EclipseEvent annotated = impactAnalyzer.annotate(natalChart, eclipse, orb);
            if (!annotated.isHasImpact()) {
                continue;
            }

            ActivationStatus status = determineStatus(annotated.getDate(), referenceDate);
            if (statusFilter != null && status != statusFilter) {
                continue;
            }

            activations.add(EclipseActivation.builder()
                    .eclipse(annotated)
                    .status(status)
                    .build());
        }

        logger.debug("일식/월식 활성 분류: 카탈로그 {}개 중 {}개 (기준일={}, 오브={})",
                eclipseCatalog.size(), activations.size(), referenceDate, orb);

        return Collections.unmodifiableList(activations);
    }

    /**
     * 기준일 대비 활성 상태 (1개월 = 30일)
     */
    public static ActivationStatus determineStatus(Instant eclipseDate, Instant referenceDate) {
        double monthsBefore = (eclipseDate.toEpochMilli() - referenceDate.toEpochMilli()) / MILLIS_PER_DAY / DAYS_PER_MONTH;
        double monthsAfter = (referenceDate.toEpochMilli() - eclipseDate.toEpochMilli()) / MILLIS_PER_DAY / DAYS_PER_MONTH;

        // 식 3개월 전부터 식 당일 전까지
        if (monthsBefore > 0 && monthsBefore <= 3) {
            return ActivationStatus.APPROACHING;
        }

        // 식 당일부터 1개월 후까지
        if (monthsAfter >= 0 && monthsAfter <= 1) {
            return ActivationStatus.ACTIVE;
        }

        if (monthsAfter > 1 && monthsAfter <= 6) {
            return ActivationStatus.INTEGRATING;
        }

        if (monthsAfter > 6) {
            return ActivationStatus.COMPLETE;
        }

        return ActivationStatus.FUTURE;
    }

    /**
     * 사로스 주기 그룹핑.
     * 입력 순서대로 각 그룹의 첫 번째 식과 비교해 사로스 주기의 정수배(1 이상) ±5일 이내면
     * 그 그룹에 넣는 탐욕적 방식이다. 입력 순서에 따라 결과가 달라질 수 있다.
     */
    public List<SarosGroup> groupBySaros(List<EclipseActivation> activations) {
        List<List<EclipseActivation>> groups = new ArrayList<>();

        for (EclipseActivation activation : activations) {
            boolean foundGroup = false;

            for (List<EclipseActivation> group : groups) {
                EclipseActivation representative = group.get(0);
                double daysDifference = Math.abs(
                        activation.getEclipse().getDate().toEpochMilli()
                                - representative.getEclipse().getDate().toEpochMilli()) / MILLIS_PER_DAY;

                long cycles = Math.round(daysDifference / SAROS_PERIOD_DAYS);
                double deviation = Math.abs(daysDifference - cycles * SAROS_PERIOD_DAYS);

                if (cycles > 0 && deviation < SAROS_TOLERANCE_DAYS) {
                    group.add(activation);
                    foundGroup = true;
                    break;
                }
            }

            if (!foundGroup) {
                List<EclipseActivation> group = new ArrayList<>();
                group.add(activation);
                groups.add(group);
            }
        }

        // 그룹 내부는 날짜순, 그룹은 가장 이른 식 날짜순
        groups.forEach(group -> group.sort(BY_DATE));
        groups.sort(Comparator.comparing(group -> group.get(0).getEclipse().getDate()));

        List<SarosGroup> result = new ArrayList<>();
        for (int i = 0; i < groups.size(); i++) {
            int groupId = i + 1;
            List<EclipseActivation> members = groups.get(i).stream()
                    .map(member -> member.toBuilder().sarosGroupId(groupId).build())
                    .collect(Collectors.toUnmodifiableList());
            result.add(new SarosGroup(groupId, members));
        }

        logger.debug("사로스 그룹핑: {}개 식 → {}개 그룹", activations.size(), result.size());
        return Collections.unmodifiableList(result);
    }

    /**
     * 상태별, 종류별, 하우스별 개수
     */
    public ActivationStats getActivationStats(List<EclipseActivation> activations) {
        Map<ActivationStatus, Integer> byStatus = new EnumMap<>(ActivationStatus.class);
        for (ActivationStatus status : ActivationStatus.values()) {
            byStatus.put(status, 0);
        }

        Map<EclipseType, Integer> byType = new EnumMap<>(EclipseType.class);
        for (EclipseType type : EclipseType.values()) {
            byType.put(type, 0);
        }

        Map<Integer, Integer> byHouse = new TreeMap<>();

        for (EclipseActivation activation : activations) {
            if (activation.getStatus() != null) {
                byStatus.merge(activation.getStatus(), 1, Integer::sum);
            }

            EclipseEvent eclipse = activation.getEclipse();
            if (eclipse.getType() != null) {
                byType.merge(eclipse.getType(), 1, Integer::sum);
            }
            if (eclipse.getHouse() != null) {
                byHouse.merge(eclipse.getHouse(), 1, Integer::sum);
            }
        }

        return new ActivationStats(activations.size(), Collections.unmodifiableMap(byStatus),
                Collections.unmodifiableMap(byType), Collections.unmodifiableMap(byHouse));
    }

    /**
     * 분류, 사로스 그룹핑, 통계를 한 번에. 활성 목록은 날짜순이며 사로스 그룹 id가 채워져 있다.
     */
    public EclipseActivationReport analyze(ChartSnapshot natalChart,
                                           List<EclipseEvent> eclipseCatalog,
                                           Instant referenceDate,
                                           double orb) {
        List<EclipseActivation> classified = classifyActivations(natalChart, eclipseCatalog, referenceDate, orb);
        List<SarosGroup> sarosGroups = groupBySaros(classified);

        List<EclipseActivation> activations = sarosGroups.stream()
                .flatMap(group -> group.getMembers().stream())
                .sorted(BY_DATE)
                .collect(Collectors.toUnmodifiableList());

        logger.info("일식/월식 분석 완료: 활성 {}개, 사로스 그룹 {}개", activations.size(), sarosGroups.size());

        return EclipseActivationReport.builder()
                .referenceDate(referenceDate)
                .orb(orb)
                .activations(activations)
                .sarosGroups(sarosGroups)
                .stats(getActivationStats(activations))
                .build();
    }
}
