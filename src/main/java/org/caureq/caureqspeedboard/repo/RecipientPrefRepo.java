package org.caureq.caureqspeedboard.repo;

import org.caureq.caureqspeedboard.domain.RecipientPref;
import org.springframework.data.jpa.repository.JpaRepository;

public interface RecipientPrefRepo extends JpaRepository<RecipientPref, String> {
}
