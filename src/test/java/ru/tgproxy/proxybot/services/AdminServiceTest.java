package ru.tgproxy.proxybot.services;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AdminServiceTest {

    @Test
    void parsesCommaSeparatedIdsIgnoringGarbage() {
        AdminService service = new AdminService(" 1, 2 ,abc,,3 ");

        assertTrue(service.isAdmin(1L));
        assertTrue(service.isAdmin(2L));
        assertTrue(service.isAdmin(3L));
        assertFalse(service.isAdmin(4L));
        assertFalse(service.isAdmin(null));
    }

    @Test
    void emptyConfigurationHasNoAdmins() {
        AdminService service = new AdminService("");

        assertFalse(service.isAdmin(1L));
        assertFalse(service.authorize(1L).allowed());
    }

    @Test
    void authorizeReportsReasonOnDenial() {
        AdminService service = new AdminService("10");

        AdminService.AdminAuthorization ok = service.authorize(10L);
        AdminService.AdminAuthorization denied = service.authorize(11L);

        assertTrue(ok.allowed());
        assertNull(ok.reason());
        assertFalse(denied.allowed());
        assertNotNull(denied.reason());
        assertFalse(service.authorize(null).allowed());
    }
}
