package com.work.validator.core.manager;

import com.work.validator.core.event.MigratedToProofOfStake;
import com.work.validator.core.exception.InvalidStateException;
import com.work.validator.core.exception.UnauthorizedException;
import com.work.validator.core.model.Bytes32;
import com.work.validator.core.model.ManagementMode;
import com.work.validator.core.model.WeightUpdate;
import com.work.validator.core.testing.LedgerFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static com.work.validator.core.testing.LedgerFixture.node;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class PoAValidatorManagerTest {

    private static final String STRANGER = LedgerFixture.address("bb");

    private final LedgerFixture f = new LedgerFixture();
    private final PoAValidatorManager poa = f.poa;

    @BeforeEach
    public void setUp() {
        f.initialize(100, 100, 100, 100, 100);
    }

    @Test
    public void admin_drives_validator_set_changes() {
        Bytes32 validationId = poa.initiateValidatorRegistration(LedgerFixture.ADMIN.toUpperCase(),
                f.registration(node(1), 20));
        f.manager.completeValidatorRegistration(f.ackRegistration(validationId, true));

        WeightUpdate update = poa.initiateValidatorWeightUpdate(LedgerFixture.ADMIN, validationId, 30);
        assertEquals(1, update.getNonce());

        WeightUpdate removal = poa.initiateValidatorRemoval(LedgerFixture.ADMIN, validationId);
        assertEquals(2, removal.getNonce());
        assertEquals(0, removal.getWeight());
    }

    @Test
    public void non_admin_is_rejected_without_side_effects() {
        UnauthorizedException e = assertThrows(UnauthorizedException.class,
                () -> poa.initiateValidatorRegistration(STRANGER, f.registration(node(1), 40)));
        assertEquals("UnauthorizedOwner", e.getErrorName());
        assertEquals(STRANGER, e.getSender());

        assertThrows(UnauthorizedException.class, () -> poa.initiateValidatorRemoval(STRANGER, f.initialValidationId(0)));
        assertThrows(UnauthorizedException.class,
                () -> poa.initiateValidatorWeightUpdate(STRANGER, f.initialValidationId(0), 120));
        assertThrows(UnauthorizedException.class, () -> poa.migrateToProofOfStake(STRANGER));

        assertEquals(500, f.manager.l1TotalWeight());
        assertTrue(f.warp.outbound().isEmpty());
        assertEquals(ManagementMode.PROOF_OF_AUTHORITY, f.manager.getManagementMode());
    }

    @Test
    public void blank_caller_is_treated_as_zero_address() {
        UnauthorizedException e = assertThrows(UnauthorizedException.class,
                () -> poa.initiateValidatorRemoval(" ", f.initialValidationId(0)));
        assertEquals("0x0000000000000000000000000000000000000000", e.getSender());
    }

    @Test
    public void unparsable_caller_is_unauthorized() {
        UnauthorizedException e = assertThrows(UnauthorizedException.class,
                () -> poa.initiateValidatorRemoval("0x1234", f.initialValidationId(0)));
        assertEquals("0x1234", e.getSender());
    }

    @Test
    public void migration_is_one_way_and_disables_admin_operations() {
        poa.migrateToProofOfStake(LedgerFixture.ADMIN);

        assertEquals(ManagementMode.PROOF_OF_STAKE, f.manager.getManagementMode());
        assertEquals(LedgerFixture.ADMIN, f.events.eventsOfType(MigratedToProofOfStake.class).get(0).getAdmin());

        InvalidStateException again = assertThrows(InvalidStateException.class,
                () -> poa.migrateToProofOfStake(LedgerFixture.ADMIN));
        assertEquals("InvalidManagementMode", again.getErrorName());

        InvalidStateException register = assertThrows(InvalidStateException.class,
                () -> poa.initiateValidatorRegistration(LedgerFixture.ADMIN, f.registration(node(1), 40)));
        assertEquals("InvalidManagementMode", register.getErrorName());
        assertEquals(ManagementMode.PROOF_OF_STAKE, register.getCurrentValue());
    }
}
