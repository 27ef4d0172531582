package com.electionlens.boothrecon.presentation.controller;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class ContestControllerTest {

    private static final String CLEAN_CONTEST = """
            {
              "contestId": "AC-101",
              "lines": ["Polling Station  A  B  C", "1 100 70 30", "2 100 60 40", "3 100 70 30"],
              "candidates": [
                {"name": "Asha", "party": "PA", "votes": 300},
                {"name": "Bala", "party": "PB", "votes": 200},
                {"name": "Chitra", "party": "PC", "votes": 100}
              ]
            }
            """;

    @Autowired
    private MockMvc mvc;

    @Test
    void reconcilesCleanContest() throws Exception {
        mvc.perform(post("/api/contests/reconcile")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(CLEAN_CONTEST))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.contestId").value("AC-101"))
                .andExpect(jsonPath("$.state").value("RECONCILED"))
                .andExpect(jsonPath("$.mapping.strategy").value("positional"))
                .andExpect(jsonPath("$.booths", hasSize(3)))
                .andExpect(jsonPath("$.booths[0].boothId").value("1"))
                .andExpect(jsonPath("$.candidates[0].name").value("Asha"))
                .andExpect(jsonPath("$.candidates[0].outOfBooth").value(0))
                .andExpect(jsonPath("$.summary.margin").value(100))
                .andExpect(jsonPath("$.skippedLines[0].reason").value("HEADER"));
    }

    @Test
    void failedContestIsStillOk() throws Exception {
        String body = """
                {
                  "contestId": "AC-102",
                  "lines": ["12 12 45 30", "13 100 5 10"],
                  "candidates": [
                    {"name": "Asha", "party": "PA", "votes": 112},
                    {"name": "Bala", "party": "PB", "votes": 50},
                    {"name": "Chitra", "party": "PC", "votes": 40}
                  ]
                }
                """;

        mvc.perform(post("/api/contests/reconcile").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state").value("FAILED"))
                .andExpect(jsonPath("$.failureKind").value("MAPPING"))
                .andExpect(jsonPath("$.attempts", hasSize(3)))
                .andExpect(jsonPath("$.issues[0]", startsWith("[self-reference]")));
    }

    @Test
    void declaredPostalVotesAreReported() throws Exception {
        String body = """
                {
                  "contestId": "AC-103",
                  "lines": ["1 98 66 34", "2 98 65 33", "3 98 65 33"],
                  "candidates": [
                    {"name": "Asha", "party": "PA", "votes": 300, "postalVotes": 6},
                    {"name": "Bala", "party": "PB", "votes": 200, "postalVotes": 4},
                    {"name": "Chitra", "party": "PC", "votes": 100}
                  ]
                }
                """;

        mvc.perform(post("/api/contests/reconcile").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state").value("RECONCILED"))
                .andExpect(jsonPath("$.candidates[0].outOfBooth").value(6))
                .andExpect(jsonPath("$.candidates[1].outOfBooth").value(4))
                .andExpect(jsonPath("$.candidates[2].outOfBooth").value(0));
    }

    @Test
    void rejectsMissingCandidates() throws Exception {
        String body = """
                {"contestId": "AC-104", "lines": ["1 10 5"], "candidates": []}
                """;

        mvc.perform(post("/api/contests/reconcile").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("ValidationFailed"));
    }

    @Test
    void rejectsDuplicateCandidate() throws Exception {
        String body = """
                {
                  "contestId": "AC-105",
                  "lines": ["1 10 5"],
                  "candidates": [
                    {"name": "Asha", "party": "PA", "votes": 10},
                    {"name": "Asha", "party": "PA", "votes": 5}
                  ]
                }
                """;

        mvc.perform(post("/api/contests/reconcile").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("InvalidContestDataException"));
    }

    @Test
    void rejectsOutOfRangeOverride() throws Exception {
        String body = """
                {
                  "contestId": "AC-106",
                  "lines": ["1 10 5"],
                  "candidates": [{"name": "Asha", "party": "PA", "votes": 10}],
                  "mappingCeiling": 2.5
                }
                """;

        mvc.perform(post("/api/contests/reconcile").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("InvalidContestDataException"));
    }

    @Test
    void rejectsUnknownMappingStrategy() throws Exception {
        String body = """
                {
                  "contestId": "AC-107",
                  "lines": ["1 10 5"],
                  "candidates": [{"name": "Asha", "party": "PA", "votes": 10}],
                  "mappingStrategies": ["hungarian"]
                }
                """;

        mvc.perform(post("/api/contests/reconcile").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details", startsWith("Invalid contest data: Unknown mapping strategy")));
    }

    @Test
    void batchReturnsOneResponsePerContestInOrder() throws Exception {
        String body = "{\"contests\": [" + CLEAN_CONTEST + ","
                + CLEAN_CONTEST.replace("AC-101", "AC-201") + "]}";

        mvc.perform(post("/api/contests/reconcile-batch").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)))
                .andExpect(jsonPath("$[0].contestId").value("AC-101"))
                .andExpect(jsonPath("$[1].contestId").value("AC-201"))
                .andExpect(jsonPath("$[1].state").value("RECONCILED"));
    }

    @Test
    void pingReportsOk() throws Exception {
        mvc.perform(get("/ping"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ok"));
    }
}
