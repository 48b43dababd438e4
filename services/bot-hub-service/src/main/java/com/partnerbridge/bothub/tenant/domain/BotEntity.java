package com.partnerbridge.bothub.tenant.domain;

import jakarta.persistence.*;
import java.time.Instant;
import org.hibernate.Hibernate;

@Entity
@Table(name = "bots")
public class BotEntity {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  // Telegram bot token, secret
  @Column(name = "credential", nullable = false, unique = true, length = 128)
  private String credential;

  @Column(name = "display_name", length = 255)
  private String displayName;

  // back-office integration token, also the correlation token of its webhooks
  @Column(name = "back_office_token", length = 255)
  private String backOfficeToken;

  @Column(name = "active", nullable = false)
  private boolean active;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected BotEntity() {
    // for JPA
  }

  public BotEntity(String credential, String displayName, String backOfficeToken, boolean active) {
    this.credential = credential;
    this.displayName = displayName;
    this.backOfficeToken = backOfficeToken;
    this.active = active;
  }

  @PrePersist
  public void prePersist() {
    if (createdAt == null) {
      createdAt = Instant.now();
    }
  }

  public Long getId() {
    return id;
  }

  public String getCredential() {
    return credential;
  }

  public String getDisplayName() {
    return displayName;
  }

  public String getBackOfficeToken() {
    return backOfficeToken;
  }

  public boolean isActive() {
    return active;
  }

  public void setActive(boolean active) {
    this.active = active;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || Hibernate.getClass(this) != Hibernate.getClass(o)) {
      return false;
    }
    BotEntity that = (BotEntity) o;
    return id != null && id.equals(that.id);
  }

  @Override
  public int hashCode() {
    return getClass().hashCode();
  }
}
