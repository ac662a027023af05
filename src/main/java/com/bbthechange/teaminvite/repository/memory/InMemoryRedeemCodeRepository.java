package com.bbthechange.teaminvite.repository.memory;

import com.bbthechange.teaminvite.model.RedeemCode;
import com.bbthechange.teaminvite.repository.RedeemCodeRepository;
import com.bbthechange.teaminvite.util.TeamInviteKeyFactory;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import static com.bbthechange.teaminvite.repository.memory.InMemorySeatStore.CODE_SCHEMA;
import static com.bbthechange.teaminvite.repository.memory.InMemorySeatStore.copy;

public class InMemoryRedeemCodeRepository implements RedeemCodeRepository {

    private final InMemorySeatStore store;

    public InMemoryRedeemCodeRepository(InMemorySeatStore store) {
        this.store = store;
    }

    @Override
    public Optional<RedeemCode> findByCode(String code) {
        return Optional.ofNullable(copy(CODE_SCHEMA, store.codes.get(code)));
    }

    @Override
    public RedeemCode save(RedeemCode code) {
        code.touch();
        store.codes.put(code.getCode(), copy(CODE_SCHEMA, code));
        return code;
    }

    @Override
    public List<RedeemCode> findActive() {
        return store.codes.values().stream()
                .filter(code -> Boolean.TRUE.equals(code.getActive()))
                .sorted(Comparator.comparing(RedeemCode::getCode))
                .map(code -> copy(CODE_SCHEMA, code))
                .collect(Collectors.toList());
    }

    @Override
    public boolean recordUse(String code, String identity) {
        synchronized (store.monitor) {
            RedeemCode stored = copy(CODE_SCHEMA, store.codes.get(code));
            if (stored == null) {
                return false;
            }
            int used = stored.getUsedCount() == null ? 0 : stored.getUsedCount();
            if (!stored.isUnlimited() && used >= stored.getMaxUses()) {
                return false;
            }
            stored.setUsedCount(used + 1);
            if (stored.getBoundIdentity() == null) {
                stored.setBoundIdentity(TeamInviteKeyFactory.normalizeIdentity(identity));
            }
            stored.touch();
            store.codes.put(code, stored);
            return true;
        }
    }

    @Override
    public boolean refundUse(String code, String refundKey) {
        synchronized (store.monitor) {
            RedeemCode stored = copy(CODE_SCHEMA, store.codes.get(code));
            if (stored == null || !store.refundMarkers.add(code + "#" + refundKey)) {
                return false;
            }
            int used = stored.getUsedCount() == null ? 0 : stored.getUsedCount();
            stored.setUsedCount(Math.max(0, used - 1));
            stored.touch();
            store.codes.put(code, stored);
            return true;
        }
    }

    @Override
    public boolean updateUsedCount(String code, int expectedUsedCount, int usedCount) {
        synchronized (store.monitor) {
            RedeemCode stored = copy(CODE_SCHEMA, store.codes.get(code));
            if (stored == null) {
                return false;
            }
            int current = stored.getUsedCount() == null ? 0 : stored.getUsedCount();
            if (current != expectedUsedCount) {
                return false;
            }
            stored.setUsedCount(usedCount);
            stored.touch();
            store.codes.put(code, stored);
            return true;
        }
    }
}
