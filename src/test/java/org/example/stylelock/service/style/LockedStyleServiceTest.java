package org.example.stylelock.service.style;

import org.example.stylelock.model.LockedStyleRecord;
import org.example.stylelock.model.LockedStyleRequest;
import org.example.stylelock.repository.LockedStyleRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DataJpaTest
@Import(LockedStyleService.class)
class LockedStyleServiceTest {

    @Autowired
    private LockedStyleService lockedStyleService;

    @Autowired
    private LockedStyleRepository lockedStyleRepository;

    @Test
    void lock_appliesDefaultsAndStartsUnapproved() {
        LockedStyleRecord record = lockedStyleService.lock("falcon-run",
                new LockedStyleRequest(" model_pixel_v2 ", null, null, null, null, null,
                        "pixel art, 16-bit palette", List.of("samples/hero.png"), 9.1));

        assertEquals(1, record.version());
        assertEquals("model_pixel_v2", record.config().modelId());
        assertEquals(30, record.config().steps());
        assertEquals(7.0, record.config().cfgScale());
        assertEquals(42L, record.config().seedBase());
        assertEquals(512, record.config().width());
        assertEquals("samples/hero.png", record.baselineRef());
        assertFalse(record.approved());
        assertTrue(record.active());
    }

    @Test
    void lock_secondTimeWithoutRelock_isRejected() {
        lockedStyleService.lock("falcon-run", request(9.0));

        StyleAlreadyLockedException error = assertThrows(StyleAlreadyLockedException.class,
                () -> lockedStyleService.lock("falcon-run", request(9.0)));

        assertTrue(error.getMessage().contains("falcon-run"));
    }

    @Test
    void lock_invalidParameters_storeNothing() {
        InvalidParameterException error = assertThrows(InvalidParameterException.class,
                () -> lockedStyleService.lock("falcon-run", new LockedStyleRequest("model_pixel_v2",
                        500, null, null, null, null, "pixel art", List.of(), 9.0)));

        assertEquals("steps", error.getField());
        assertTrue(lockedStyleService.findActive("falcon-run").isEmpty());
    }

    @Test
    void requireApproved_unapprovedOrMissing_throwsMissingLock() {
        assertThrows(MissingLockException.class, () -> lockedStyleService.requireApproved("falcon-run"));

        lockedStyleService.lock("falcon-run", request(9.0));

        MissingLockException error = assertThrows(MissingLockException.class,
                () -> lockedStyleService.requireApproved("falcon-run"));
        assertEquals("falcon-run", error.getProjectId());
    }

    @Test
    void approve_withPassingValidationScore_enablesBatches() {
        lockedStyleService.lock("falcon-run", request(8.7));

        LockedStyleRecord approved = lockedStyleService.approve("falcon-run");

        assertTrue(approved.approved());
        assertEquals(approved.version(), lockedStyleService.requireApproved("falcon-run").version());
    }

    @Test
    void approve_belowMinimumScore_isRejected() {
        lockedStyleService.lock("falcon-run", request(8.2));

        InvalidParameterException error = assertThrows(InvalidParameterException.class,
                () -> lockedStyleService.approve("falcon-run"));

        assertEquals("consistencyScore", error.getField());
        assertFalse(lockedStyleService.findActive("falcon-run").orElseThrow().approved());
    }

    @Test
    void relock_supersedesActiveVersionAndKeepsHistory() {
        lockedStyleService.lock("falcon-run", request(9.0));
        lockedStyleService.approve("falcon-run");

        LockedStyleRecord relocked = lockedStyleService.relock("falcon-run", new LockedStyleRequest(
                "model_pixel_v3", 40, 6.0, 7L, 768, 768, "pixel art", List.of(), 9.3));

        assertEquals(2, relocked.version());
        assertFalse(relocked.approved());
        assertThrows(MissingLockException.class, () -> lockedStyleService.requireApproved("falcon-run"));

        List<LockedStyleRecord> history = lockedStyleService.history("falcon-run");
        assertEquals(List.of(2, 1), history.stream().map(LockedStyleRecord::version).toList());
        assertFalse(history.get(1).active());
        assertTrue(history.get(1).approved());
        assertEquals(2, lockedStyleRepository.findByProjectIdOrderByVersionDesc("falcon-run").size());
    }

    @Test
    void relock_invalidParameters_keepPreviousVersionActive() {
        lockedStyleService.lock("falcon-run", request(9.0));

        assertThrows(InvalidParameterException.class, () -> lockedStyleService.relock("falcon-run",
                new LockedStyleRequest("model_pixel_v2", null, null, null, 500, null, "pixel art", null, null)));

        assertEquals(1, lockedStyleService.findActive("falcon-run").orElseThrow().version());
    }

    private LockedStyleRequest request(Double consistencyScore) {
        return new LockedStyleRequest("model_pixel_v2", 30, 7.0, 42L, 512, 512,
                "pixel art", List.of("samples/hero.png"), consistencyScore);
    }
}
