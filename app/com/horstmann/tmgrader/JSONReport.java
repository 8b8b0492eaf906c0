package com.horstmann.tmgrader;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

public class JSONReport implements Report {
    public static class Item {
        public String test;
        public String verdict;
        public String detail;
        public List<String> candidates;
    }

    public static class Group {
        public int group;
        public int passed;
        public List<Item> results = new ArrayList<>();
    }

    public static class ReportData {
        public String assignment;
        public int tests;
        public List<Group> groups = new ArrayList<>();
    }

    private final ReportData data = new ReportData();
    private final Map<Integer, Group> groups = new LinkedHashMap<>();

    @Override
    public JSONReport header(String assignment, int groupCount, int tests) {
        data.assignment = assignment;
        data.tests = tests;
        return this;
    }

    @Override
    public JSONReport verdict(int groupId, String test, Verdict verdict) {
        Group group = groups.computeIfAbsent(groupId, id -> {
            Group g = new Group();
            g.group = id;
            data.groups.add(g);
            return g;
        });
        Item item = new Item();
        item.test = test;
        item.verdict = verdict.getKind().name();
        item.detail = verdict.getDetail();
        if (!verdict.getCandidates().isEmpty()) {
            item.candidates = new ArrayList<>();
            for (Object candidate : verdict.getCandidates()) item.candidates.add(candidate.toString());
        }
        if (verdict.isPass()) group.passed++;
        group.results.add(item);
        return this;
    }

    @Override
    public String getText() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.setSerializationInclusion(Include.NON_EMPTY);
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        try {
            return mapper.writeValueAsString(data);
        } catch (JsonProcessingException e) {
            throw new GraderException("Cannot write report", e);
        }
    }
}
