package com.smartbottle.tracker.ble;

import com.smartbottle.tracker.data.PeripheralHandle;

import java.util.List;

public interface DeviceListListener {
    /** Full current list, preferred devices first. */
    void onDevicesChanged(List<PeripheralHandle> devices);
}
