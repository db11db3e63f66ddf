package com.example.podcast_backend.dto;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class WordsParserTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void readsItemsInMilliseconds() throws Exception {
        assertThat(WordsParser.extract(objectMapper.readTree("""
                {"items":[{"text":"b","startMs":500,"endMs":700},{"text":"a","startMs":0,"endMs":400}]}
                """))).containsExactly(new WordTiming("a", 0, 400), new WordTiming("b", 500, 700));
    }

    @Test
    void readsSegmentWordsInSeconds() throws Exception {
        assertThat(WordsParser.extract(objectMapper.readTree("""
                {"segments":[{"text":"hi there","words":[{"word":"hi","start":1.0,"end":1.25},{"word":"there","start":1.3,"end":1.6}]}]}
                """))).containsExactly(new WordTiming("hi", 1000, 1250), new WordTiming("there", 1300, 1600));
    }

    @Test
    void readsBareArraysAndSkipsBlankWords() throws Exception {
        assertThat(WordsParser.extract(objectMapper.readTree("""
                [{"word":"ok","start":0.1,"end":0.2},{"word":" ","start":0.3,"end":0.4}]
                """))).containsExactly(new WordTiming("ok", 100, 200));
    }

    @Test
    void unknownShapesYieldNothing() throws Exception {
        assertThat(WordsParser.extract(objectMapper.readTree("{\"text\":\"no timings\"}"))).isEmpty();
        assertThat(WordsParser.extract(null)).isEmpty();
    }
}
