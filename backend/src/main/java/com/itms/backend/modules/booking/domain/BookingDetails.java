package com.itms.backend.modules.booking.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;

/**
 * Purpose/attendee metadata of a booking. Opaque to the engine.
 */
@Embeddable
public class BookingDetails {

    @Column(name = "title", nullable = false, length = 200)
    private String title;

    @Column(name = "purpose")
    private String purpose;

    @Column(name = "attendees")
    private Integer attendees;

    @Column(name = "contact_info", length = 200)
    private String contactInfo;

    @Column(name = "special_requirements")
    private String specialRequirements;

    protected BookingDetails() {
    }

    public BookingDetails(String title, String purpose, Integer attendees, String contactInfo,
                          String specialRequirements) {
        this.title = title;
        this.purpose = purpose;
        this.attendees = attendees;
        this.contactInfo = contactInfo;
        this.specialRequirements = specialRequirements;
    }

    public static BookingDetails titled(String title) {
        return new BookingDetails(title, null, null, null, null);
    }

    public String getTitle() {
        return title;
    }

    public String getPurpose() {
        return purpose;
    }

    public Integer getAttendees() {
        return attendees;
    }

    public String getContactInfo() {
        return contactInfo;
    }

    public String getSpecialRequirements() {
        return specialRequirements;
    }
}
