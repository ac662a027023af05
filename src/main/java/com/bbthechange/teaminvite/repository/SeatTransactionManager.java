package com.bbthechange.teaminvite.repository;

public interface SeatTransactionManager {

    SeatTransaction begin();
}
