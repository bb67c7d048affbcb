package com.chapterbus.api;

import com.chapterbus.persistence.ChapterStore;
import com.chapterbus.pipeline.ChapterSnapshot;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/v1/chapters")
public class ChapterController {

    private final ChapterStore chapterStore;

    public ChapterController(ChapterStore chapterStore) {
        this.chapterStore = chapterStore;
    }

    @GetMapping
    public List<Integer> committed() {
        return chapterStore.committedChapters();
    }

    @GetMapping("/{chapterNumber}")
    public ChapterSnapshot chapter(@PathVariable int chapterNumber) {
        return chapterStore.find(chapterNumber)
            .orElseThrow(() -> new NotFoundException("chapter " + chapterNumber + " has not been committed"));
    }
}
